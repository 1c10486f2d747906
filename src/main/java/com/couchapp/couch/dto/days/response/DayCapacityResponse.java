package com.couchapp.couch.dto.days.response;

import lombok.*;

import java.util.Set;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DayCapacityResponse {
    private int weekday;
    private int totalMinutes;
    private int usedMinutes;
    private int availableMinutes;
    private Set<String> genres;
}
