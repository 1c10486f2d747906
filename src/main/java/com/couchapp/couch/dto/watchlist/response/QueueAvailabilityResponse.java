package com.couchapp.couch.dto.watchlist.response;

import lombok.*;

import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class QueueAvailabilityResponse {
    private Long entryId;
    private String title;
    private boolean available;
    private LocalDate airDate;
}
