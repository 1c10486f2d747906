package com.couchapp.common.exception;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a watchlist entry is asked to move between states its current status does not allow,
 * e.g. promoting an entry that is already being watched.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    public InvalidTransitionException(Long entryId, String currentStatus, String action, String message) {
        super(message);
        this.errorCode = "INVALID_TRANSITION";

        Map<String, Object> d = new LinkedHashMap<>();
        d.put("entryId", entryId);
        d.put("status", currentStatus);
        d.put("action", action);
        this.details = d;
    }
}
