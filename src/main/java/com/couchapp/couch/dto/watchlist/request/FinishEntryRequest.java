package com.couchapp.couch.dto.watchlist.request;

import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class FinishEntryRequest {

    @NotNull
    private Long entryId;

    // promote the queued show whose runtime best matches the freed slot
    private boolean autoPromote;
}
