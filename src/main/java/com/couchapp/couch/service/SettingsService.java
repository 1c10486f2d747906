package com.couchapp.couch.service;

import com.couchapp.common.exception.BadRequestException;
import com.couchapp.couch.domain.planning.Weekdays;
import com.couchapp.couch.domain.settings.Settings;
import com.couchapp.couch.dto.settings.request.UpdateSettingsRequest;
import com.couchapp.couch.dto.settings.response.SettingsResponse;
import com.couchapp.couch.repository.SettingsRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    private final SettingsRepository settingsRepository;
    private final TimeBudgetService timeBudgetService;
    private final ScheduleInvalidationService scheduleInvalidationService;

    @Transactional(readOnly = true)
    public SettingsResponse get() {
        return toResponse(timeBudgetService.currentSettings());
    }

    @Transactional
    public SettingsResponse update(UpdateSettingsRequest request) {
        validate(request);

        Settings settings = settingsRepository.findById(Settings.SINGLETON_ID)
                .orElseGet(Settings::defaults);

        if (request.getWeekdayMinutes() != null) settings.setWeekdayMinutes(request.getWeekdayMinutes());
        if (request.getWeekendMinutes() != null) settings.setWeekendMinutes(request.getWeekendMinutes());

        settings.setSundayMinutes(request.getSundayMinutes());
        settings.setMondayMinutes(request.getMondayMinutes());
        settings.setTuesdayMinutes(request.getTuesdayMinutes());
        settings.setWednesdayMinutes(request.getWednesdayMinutes());
        settings.setThursdayMinutes(request.getThursdayMinutes());
        settings.setFridayMinutes(request.getFridayMinutes());
        settings.setSaturdayMinutes(request.getSaturdayMinutes());

        if (request.getSchedulingMode() != null) settings.setSchedulingMode(request.getSchedulingMode());

        scheduleInvalidationService.invalidateAll();

        Settings saved = settingsRepository.save(settings);
        log.info("Settings updated: weekday {} min, weekend {} min, mode {}",
                saved.getWeekdayMinutes(), saved.getWeekendMinutes(), saved.getSchedulingMode());
        return toResponse(saved);
    }

    private void validate(UpdateSettingsRequest request) {
        Map<String, Integer> minutes = new LinkedHashMap<>();
        minutes.put("weekdayMinutes", request.getWeekdayMinutes());
        minutes.put("weekendMinutes", request.getWeekendMinutes());
        minutes.put("sundayMinutes", request.getSundayMinutes());
        minutes.put("mondayMinutes", request.getMondayMinutes());
        minutes.put("tuesdayMinutes", request.getTuesdayMinutes());
        minutes.put("wednesdayMinutes", request.getWednesdayMinutes());
        minutes.put("thursdayMinutes", request.getThursdayMinutes());
        minutes.put("fridayMinutes", request.getFridayMinutes());
        minutes.put("saturdayMinutes", request.getSaturdayMinutes());

        for (Map.Entry<String, Integer> e : minutes.entrySet()) {
            if (e.getValue() != null && e.getValue() < 0) {
                throw new BadRequestException(e.getKey() + " must be >= 0", "BAD_REQUEST",
                        Map.of(e.getKey(), e.getValue()));
            }
        }
    }

    private SettingsResponse toResponse(Settings s) {
        List<Integer> effective = new ArrayList<>();
        for (int d = Weekdays.SUNDAY; d <= Weekdays.SATURDAY; d++) {
            effective.add(TimeBudgetService.resolve(s, d));
        }

        return SettingsResponse.builder()
                .weekdayMinutes(s.getWeekdayMinutes())
                .weekendMinutes(s.getWeekendMinutes())
                .sundayMinutes(s.getSundayMinutes())
                .mondayMinutes(s.getMondayMinutes())
                .tuesdayMinutes(s.getTuesdayMinutes())
                .wednesdayMinutes(s.getWednesdayMinutes())
                .thursdayMinutes(s.getThursdayMinutes())
                .fridayMinutes(s.getFridayMinutes())
                .saturdayMinutes(s.getSaturdayMinutes())
                .schedulingMode(s.getSchedulingMode())
                .effectiveMinutes(effective)
                .build();
    }
}
