package com.couchapp.couch.domain.planning;

import com.couchapp.couch.domain.show.Show;
import com.couchapp.couch.domain.watchlist.WatchlistEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fills a single day's budget from the shows assigned to it.
 *
 * Rules:
 * - One pass over the entries in the given order, at most one episode per show.
 * - A show is placed only if its runtime fits the remaining budget and its next episode number
 *   does not exceed the show's total episode count.
 * - Ongoing shows additionally need the episode confirmed by the availability gate. A refusal
 *   skips the show for the day without spending budget.
 * - Each placement advances that entry's position in {@code positions}, which the caller threads
 *   across consecutive days.
 */
public final class DayFiller {

    @FunctionalInterface
    public interface AvailabilityGate {
        boolean isAvailable(Show show, int season, int episode);
    }

    private DayFiller() {}

    public static List<PlannedEpisode> fill(int budgetMinutes,
                                            List<WatchlistEntry> entries,
                                            Map<Long, EpisodePosition> positions,
                                            AvailabilityGate gate) {
        List<PlannedEpisode> planned = new ArrayList<>();
        int remaining = budgetMinutes;
        int order = 0;

        for (WatchlistEntry entry : entries) {
            if (remaining <= 0) break;

            Show show = entry.getShow();
            int runtime = show.runtimeMinutes();
            EpisodePosition pos = positions.computeIfAbsent(entry.getId(),
                    id -> new EpisodePosition(entry.getCurrentSeason(), entry.getCurrentEpisode()));

            if (remaining < runtime) continue;
            if (pos.episode() > safeTotal(show)) continue;

            if (show.isOngoing() && !gate.isAvailable(show, pos.season(), pos.episode())) {
                continue;
            }

            planned.add(new PlannedEpisode(entry.getId(), show.getId(), pos.season(), pos.episode(), runtime, order));
            positions.put(entry.getId(), pos.next());
            remaining -= runtime;
            order++;
        }

        return planned;
    }

    private static int safeTotal(Show show) {
        return show.getTotalEpisodes() == null ? 0 : show.getTotalEpisodes();
    }
}
