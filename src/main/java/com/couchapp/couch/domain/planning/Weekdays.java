package com.couchapp.couch.domain.planning;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Weekday indexes used throughout scheduling: 0 = Sunday .. 6 = Saturday.
 */
public final class Weekdays {

    public static final int SUNDAY = 0;
    public static final int SATURDAY = 6;
    public static final int COUNT = 7;

    private Weekdays() {}

    public static int of(LocalDate date) {
        return of(date.getDayOfWeek());
    }

    public static int of(DayOfWeek dow) {
        // DayOfWeek runs MONDAY(1) .. SUNDAY(7)
        return dow.getValue() % 7;
    }

    public static boolean isValid(Integer weekday) {
        return weekday != null && weekday >= SUNDAY && weekday <= SATURDAY;
    }

    public static boolean isWeekend(int weekday) {
        return weekday == SUNDAY || weekday == SATURDAY;
    }

    /**
     * Drops nulls, out-of-range values and duplicates; result is sorted.
     */
    public static Set<Integer> sanitize(Collection<Integer> weekdays) {
        Set<Integer> out = new TreeSet<>();
        if (weekdays == null) return out;
        for (Integer d : weekdays) {
            if (isValid(d)) out.add(d);
        }
        return out;
    }
}
