package com.couchapp.couch.domain.planning;

/**
 * Next episode to schedule for a show. Advancing never rolls over into the next season: the
 * catalog does not report per-season episode counts.
 */
public record EpisodePosition(int season, int episode) {

    public EpisodePosition next() {
        return new EpisodePosition(season, episode + 1);
    }

    public boolean isBefore(EpisodePosition other) {
        if (season != other.season) return season < other.season;
        return episode < other.episode;
    }
}
