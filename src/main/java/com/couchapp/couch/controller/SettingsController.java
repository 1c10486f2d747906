package com.couchapp.couch.controller;

import com.couchapp.couch.dto.common.ApiResponse;
import com.couchapp.couch.dto.settings.request.UpdateSettingsRequest;
import com.couchapp.couch.dto.settings.response.SettingsResponse;
import com.couchapp.couch.service.SettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/settings")
public class SettingsController {

    private final SettingsService settingsService;

    @PostMapping("/get")
    public SettingsResponse get() {
        return settingsService.get();
    }

    @PostMapping("/update")
    public ApiResponse<SettingsResponse> update(@Valid @RequestBody UpdateSettingsRequest request) {
        return ApiResponse.ok("Settings saved; schedule will be regenerated", settingsService.update(request));
    }
}
