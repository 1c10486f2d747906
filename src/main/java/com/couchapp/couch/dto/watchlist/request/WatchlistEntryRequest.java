package com.couchapp.couch.dto.watchlist.request;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class WatchlistEntryRequest {
    @NotNull private Long entryId;
}
