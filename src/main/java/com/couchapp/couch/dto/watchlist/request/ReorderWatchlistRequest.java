package com.couchapp.couch.dto.watchlist.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ReorderWatchlistRequest {
    @NotEmpty private List<Long> orderedIds;
}
