package com.couchapp.couch.dto.schedule.response;

import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DashboardResponse {
    private ScheduleDayResponse today;
    private List<ScheduledEpisodeResponse> yesterdayPending;
    private boolean needsCheckIn;
}
