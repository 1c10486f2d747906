package com.couchapp.couch.dto.watchlist.request;

import com.couchapp.couch.domain.settings.SchedulingMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FollowShowRequest {

    @NotNull
    private Long catalogId;

    @Min(1)
    private Integer startSeason;

    @Min(1)
    private Integer startEpisode;

    private Integer priority;

    private SchedulingMode modeOverride;
}
