package com.couchapp.couch.dto.watchlist.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FinishEntryResponse {

    private WatchlistEntryResponse finishedEntry;

    /** True when the show is still airing and went back to the queue instead of finishing. */
    private boolean movedToQueue;

    private WatchlistEntryResponse promotedEntry;
}
