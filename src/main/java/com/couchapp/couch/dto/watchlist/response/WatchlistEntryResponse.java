package com.couchapp.couch.dto.watchlist.response;

import com.couchapp.couch.domain.settings.SchedulingMode;
import com.couchapp.couch.domain.watchlist.WatchlistEntry;
import com.couchapp.couch.domain.watchlist.WatchlistStatus;
import com.couchapp.couch.dto.show.response.ShowResponse;
import lombok.*;

import java.time.Instant;
import java.util.Set;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WatchlistEntryResponse {

    private Long id;

    private ShowResponse show;

    private Integer priority;

    private Integer startSeason;
    private Integer startEpisode;

    private Integer currentSeason;
    private Integer currentEpisode;

    private WatchlistStatus status;

    private SchedulingMode modeOverride;

    private Set<Integer> weekdays;

    private Instant createdAt;
    private Instant updatedAt;

    public static WatchlistEntryResponse of(WatchlistEntry e) {
        return WatchlistEntryResponse.builder()
                .id(e.getId())
                .show(e.getShow() != null ? ShowResponse.of(e.getShow()) : null)
                .priority(e.getPriority())
                .startSeason(e.getStartSeason())
                .startEpisode(e.getStartEpisode())
                .currentSeason(e.getCurrentSeason())
                .currentEpisode(e.getCurrentEpisode())
                .status(e.getStatus())
                .modeOverride(e.getModeOverride())
                .weekdays(e.assignedWeekdays())
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .build();
    }
}
