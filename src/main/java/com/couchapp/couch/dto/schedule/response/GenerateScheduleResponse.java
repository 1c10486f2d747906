package com.couchapp.couch.dto.schedule.response;

import com.couchapp.couch.domain.settings.SchedulingMode;
import lombok.*;

import java.time.LocalDate;
import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GenerateScheduleResponse {
    private LocalDate startDate;
    private int days;
    private SchedulingMode schedulingMode;
    private int episodeCount;
    private List<ScheduleDayResponse> schedule;
}
