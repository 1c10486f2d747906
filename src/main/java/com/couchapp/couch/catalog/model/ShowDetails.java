package com.couchapp.couch.catalog.model;

import java.util.List;

public record ShowDetails(
        Long catalogId,
        String title,
        String overview,
        String posterPath,
        List<String> genres,
        int totalSeasons,
        int totalEpisodes,
        int episodeRuntime,
        String status
) {}
