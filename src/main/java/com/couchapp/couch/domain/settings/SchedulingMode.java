package com.couchapp.couch.domain.settings;

/**
 * How episodes of several shows are interleaved within a day. With one episode per show per
 * day both modes produce the same queue; the value is stored and passed through for a future
 * multi-episode-per-day policy.
 */
public enum SchedulingMode {
    SEQUENTIAL,
    ROUND_ROBIN
}
