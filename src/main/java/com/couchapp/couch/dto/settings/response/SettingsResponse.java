package com.couchapp.couch.dto.settings.response;

import com.couchapp.couch.domain.settings.SchedulingMode;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SettingsResponse {

    private Integer weekdayMinutes;
    private Integer weekendMinutes;

    private Integer sundayMinutes;
    private Integer mondayMinutes;
    private Integer tuesdayMinutes;
    private Integer wednesdayMinutes;
    private Integer thursdayMinutes;
    private Integer fridayMinutes;
    private Integer saturdayMinutes;

    private SchedulingMode schedulingMode;

    /** Resolved budget per weekday, index 0 = Sunday. */
    private List<Integer> effectiveMinutes;
}
