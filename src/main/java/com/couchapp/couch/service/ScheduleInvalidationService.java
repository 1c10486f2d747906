package com.couchapp.couch.service;

import com.couchapp.couch.domain.planning.EpisodePosition;
import com.couchapp.couch.domain.schedule.EpisodeStatus;
import com.couchapp.couch.domain.schedule.ScheduledEpisode;
import com.couchapp.couch.domain.watchlist.WatchlistEntry;
import com.couchapp.couch.repository.ScheduleDayRepository;
import com.couchapp.couch.repository.ScheduledEpisodeRepository;
import com.couchapp.couch.repository.WatchlistEntryRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps watchlist positions consistent with the generated schedule cache.
 *
 * Generation advances each entry's position past the episodes it places. When those placements
 * are thrown away before being watched, the entry is rewound to the earliest discarded pending
 * episode so the next generation starts from the same point.
 */
@Service
@RequiredArgsConstructor
public class ScheduleInvalidationService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleInvalidationService.class);

    private final ScheduledEpisodeRepository scheduledEpisodeRepository;
    private final ScheduleDayRepository scheduleDayRepository;
    private final WatchlistEntryRepository watchlistEntryRepository;

    /**
     * Drops every generated day. Callers invoke this before applying a change to settings,
     * assignments or positions.
     */
    @Transactional
    public void invalidateAll() {
        int rewound = rewind(scheduledEpisodeRepository.findAllByStatus(EpisodeStatus.PENDING));

        scheduledEpisodeRepository.deleteAllInBatch();
        scheduleDayRepository.deleteAllInBatch();

        log.info("Schedule invalidated ({} watchlist positions rewound)", rewound);
    }

    /**
     * Readies {@code start..end} for a rebuild: positions are rewound from every pending episode
     * dated on or after {@code start}, and days after {@code end} are dropped since they were
     * planned from positions the rebuild is about to recompute. Days inside the range are left for
     * the generator to overwrite.
     */
    @Transactional
    public int prepareRegeneration(LocalDate start, LocalDate end) {
        int rewound = rewind(scheduledEpisodeRepository.findByStatusFrom(EpisodeStatus.PENDING, start));

        scheduledEpisodeRepository.deleteAfter(end);
        int dropped = scheduleDayRepository.deleteAfter(end);
        if (dropped > 0) {
            log.debug("Dropped {} schedule days after {}", dropped, end);
        }
        return rewound;
    }

    private int rewind(List<ScheduledEpisode> pending) {
        if (pending.isEmpty()) return 0;

        Map<Long, EpisodePosition> earliestByShow = new HashMap<>();
        for (ScheduledEpisode ep : pending) {
            EpisodePosition pos = new EpisodePosition(ep.getSeason(), ep.getEpisode());
            earliestByShow.merge(ep.getShow().getId(), pos, (a, b) -> b.isBefore(a) ? b : a);
        }

        int rewound = 0;
        for (Map.Entry<Long, EpisodePosition> e : earliestByShow.entrySet()) {
            WatchlistEntry entry = watchlistEntryRepository.findByShow_Id(e.getKey()).orElse(null);
            if (entry == null) continue;

            EpisodePosition current = new EpisodePosition(entry.getCurrentSeason(), entry.getCurrentEpisode());
            EpisodePosition earliest = e.getValue();
            if (earliest.isBefore(current)) {
                entry.setCurrentSeason(earliest.season());
                entry.setCurrentEpisode(earliest.episode());
                watchlistEntryRepository.save(entry);
                rewound++;
            }
        }
        return rewound;
    }
}
