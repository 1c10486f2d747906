package com.couchapp.couch.domain.planning;

import com.couchapp.couch.domain.watchlist.WatchlistEntry;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Chooses which queued show should take over a slot freed by a finished show: the closer its
 * runtime to the freed runtime, the better ({@code 100 - |delta|}). Ties go to the lower
 * priority value, then the older entry.
 */
public final class QueueCandidateSelector {

    private QueueCandidateSelector() {}

    public static Optional<WatchlistEntry> pick(List<WatchlistEntry> queued, int freedRuntime) {
        if (queued == null || queued.isEmpty()) return Optional.empty();

        return queued.stream()
                .min(Comparator
                        .comparingInt((WatchlistEntry e) -> score(e, freedRuntime)).reversed()
                        .thenComparingInt(e -> e.getPriority() == null ? 0 : e.getPriority())
                        .thenComparing(WatchlistEntry::getId, Comparator.nullsLast(Comparator.naturalOrder())));
    }

    public static int score(WatchlistEntry entry, int freedRuntime) {
        return 100 - Math.abs(entry.getShow().runtimeMinutes() - freedRuntime);
    }
}
