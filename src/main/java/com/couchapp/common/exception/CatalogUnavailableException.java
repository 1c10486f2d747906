package com.couchapp.common.exception;

import lombok.Getter;

import java.util.Map;

/**
 * The external show catalog could not be reached, timed out or answered with an error.
 */
@Getter
public class CatalogUnavailableException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    public CatalogUnavailableException(String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = "CATALOG_UNAVAILABLE";
        this.details = details;
    }

    public CatalogUnavailableException(String message, Map<String, Object> details) {
        this(message, details, null);
    }

    public CatalogUnavailableException(String message) {
        this(message, null, null);
    }
}
