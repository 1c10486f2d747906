package com.couchapp.couch.catalog.model;

import java.util.List;

public record ShowSearchResult(
        Long catalogId,
        String title,
        String overview,
        String posterPath,
        String firstAirDate,
        Double voteAverage,
        List<Integer> genreIds
) {}
