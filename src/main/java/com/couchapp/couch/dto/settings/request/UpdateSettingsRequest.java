package com.couchapp.couch.dto.settings.request;

import com.couchapp.couch.domain.settings.SchedulingMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.*;

/**
 * Null weekday/weekend defaults keep the stored value; null per-day overrides clear the override.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UpdateSettingsRequest {

    @Min(0) @Max(1440) private Integer weekdayMinutes;
    @Min(0) @Max(1440) private Integer weekendMinutes;

    @Min(0) @Max(1440) private Integer sundayMinutes;
    @Min(0) @Max(1440) private Integer mondayMinutes;
    @Min(0) @Max(1440) private Integer tuesdayMinutes;
    @Min(0) @Max(1440) private Integer wednesdayMinutes;
    @Min(0) @Max(1440) private Integer thursdayMinutes;
    @Min(0) @Max(1440) private Integer fridayMinutes;
    @Min(0) @Max(1440) private Integer saturdayMinutes;

    private SchedulingMode schedulingMode;
}
