package com.couchapp.couch.dto.watchlist.request;

import com.couchapp.couch.domain.watchlist.WatchlistStatus;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class UpdateStatusRequest {
    @NotNull private Long entryId;
    @NotNull private WatchlistStatus status;
}
