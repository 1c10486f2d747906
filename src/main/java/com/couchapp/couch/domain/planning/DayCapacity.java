package com.couchapp.couch.domain.planning;

/**
 * Minutes budgeted for a weekday against the runtimes of the shows currently watched on it.
 * {@code availableMinutes} is not clamped and goes negative when a day is over-assigned.
 */
public record DayCapacity(int weekday, int totalMinutes, int usedMinutes) {

    public int availableMinutes() {
        return totalMinutes - usedMinutes;
    }

    public boolean fits(int runtime) {
        return availableMinutes() >= runtime;
    }
}
