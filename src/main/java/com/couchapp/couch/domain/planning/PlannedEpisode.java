package com.couchapp.couch.domain.planning;

public record PlannedEpisode(
        Long entryId,
        Long showId,
        int season,
        int episode,
        int runtime,
        int order
) {}
