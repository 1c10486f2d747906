package com.couchapp.couch.dto.schedule.request;

import com.couchapp.couch.domain.schedule.EpisodeStatus;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class UpdateEpisodeStatusRequest {
    @NotNull private Long episodeId;
    @NotNull private EpisodeStatus status;
}
