package com.couchapp.couch.domain.show;

import java.util.Locale;
import java.util.Set;

public enum ShowLifecycle {
    ONGOING,
    ENDED;

    private static final Set<String> ONGOING_STATUSES = Set.of(
            "returning series",
            "in production",
            "planned",
            "pilot"
    );

    /**
     * Maps the catalog's free-text status onto the two states the scheduler cares about.
     * Unknown or missing statuses count as ended so no availability lookups are made for them.
     */
    public static ShowLifecycle fromCatalogStatus(String status) {
        if (status == null || status.isBlank()) return ENDED;
        return ONGOING_STATUSES.contains(status.trim().toLowerCase(Locale.ROOT)) ? ONGOING : ENDED;
    }
}
