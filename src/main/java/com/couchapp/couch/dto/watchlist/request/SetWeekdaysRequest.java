package com.couchapp.couch.dto.watchlist.request;

import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SetWeekdaysRequest {

    @NotNull
    private Long entryId;

    /** 0 = Sunday .. 6 = Saturday; invalid values and duplicates are dropped. */
    @NotNull
    private List<Integer> weekdays;
}
