package com.couchapp.couch.dto.schedule.response;

import com.couchapp.couch.domain.schedule.EpisodeStatus;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ScheduledEpisodeResponse {
    private Long id;
    private Long showId;
    private Long catalogId;
    private String title;
    private Integer season;
    private Integer episode;
    private Integer runtime;
    private Integer order;
    private EpisodeStatus status;
}
