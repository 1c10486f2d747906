package com.couchapp.common.exception;

import lombok.Getter;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The next episode of an ongoing series has not aired yet. {@code airDate} is null when the
 * catalog does not announce one.
 */
@Getter
public class NotYetAvailableException extends RuntimeException {

    public static final String UNKNOWN_AIR_DATE = "TBA";

    private final Long entryId;
    private final LocalDate airDate;

    public NotYetAvailableException(Long entryId, LocalDate airDate) {
        super(airDate == null
                ? "No episodes available yet. Air date " + UNKNOWN_AIR_DATE
                : "No episodes available yet. Next episode airs " + airDate);
        this.entryId = entryId;
        this.airDate = airDate;
    }

    public String getErrorCode() {
        return "NOT_YET_AVAILABLE";
    }

    public Map<String, Object> getDetails() {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("entryId", entryId);
        d.put("airDate", airDate == null ? UNKNOWN_AIR_DATE : airDate.toString());
        return d;
    }
}
