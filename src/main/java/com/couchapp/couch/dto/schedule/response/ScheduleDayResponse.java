package com.couchapp.couch.dto.schedule.response;

import lombok.*;

import java.time.LocalDate;
import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ScheduleDayResponse {
    private Long id;
    private LocalDate date;
    private int weekday;
    private int plannedMinutes;
    private int scheduledMinutes;
    private List<ScheduledEpisodeResponse> episodes;
}
