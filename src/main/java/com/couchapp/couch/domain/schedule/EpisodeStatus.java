package com.couchapp.couch.domain.schedule;

public enum EpisodeStatus {
    PENDING,
    WATCHED,
    SKIPPED
}
