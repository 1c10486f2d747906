package com.couchapp.couch.domain.watchlist;

public enum WatchlistStatus {
    QUEUED,
    WATCHING,
    FINISHED,
    DROPPED
}
