package com.couchapp.couch.catalog.model;

import java.time.LocalDate;

/**
 * Whether an episode has aired. {@code airDate} is the known (or announced) air date, null when
 * the catalog has none.
 */
public record EpisodeAvailability(boolean available, LocalDate airDate) {

    public static EpisodeAvailability availableNow() {
        return new EpisodeAvailability(true, null);
    }

    public static EpisodeAvailability unavailable(LocalDate airDate) {
        return new EpisodeAvailability(false, airDate);
    }
}
