package com.couchapp.couch.controller;

import com.couchapp.couch.dto.common.ApiResponse;
import com.couchapp.couch.dto.schedule.request.GenerateScheduleRequest;
import com.couchapp.couch.dto.schedule.request.GetScheduleDayRequest;
import com.couchapp.couch.dto.schedule.request.UpdateEpisodeStatusRequest;
import com.couchapp.couch.dto.schedule.response.DashboardResponse;
import com.couchapp.couch.dto.schedule.response.GenerateScheduleResponse;
import com.couchapp.couch.dto.schedule.response.ScheduleDayResponse;
import com.couchapp.couch.dto.schedule.response.ScheduledEpisodeResponse;
import com.couchapp.couch.service.ScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/schedule")
public class ScheduleController {

    private final ScheduleService scheduleService;

    @PostMapping("/generate")
    public GenerateScheduleResponse generate(@Valid @RequestBody GenerateScheduleRequest request) {
        return scheduleService.generate(request.getStartDate(), request.getDays());
    }

    @PostMapping("/day")
    public ScheduleDayResponse day(@Valid @RequestBody GetScheduleDayRequest request) {
        return scheduleService.getDay(request.getDate());
    }

    @PostMapping("/dashboard")
    public DashboardResponse dashboard() {
        return scheduleService.dashboard();
    }

    @PostMapping("/episode-status")
    public ScheduledEpisodeResponse episodeStatus(@Valid @RequestBody UpdateEpisodeStatusRequest request) {
        return scheduleService.updateEpisodeStatus(request.getEpisodeId(), request.getStatus());
    }

    @PostMapping("/clear")
    public ApiResponse<Void> clear() {
        scheduleService.clear();
        return ApiResponse.ok("Schedule cleared", null);
    }
}
