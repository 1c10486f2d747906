package com.couchapp.couch.dto.watchlist.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class UpdateProgressRequest {

    @NotNull
    private Long entryId;

    @NotNull
    @Min(1)
    private Integer season;

    @NotNull
    @Min(1)
    private Integer episode;
}
