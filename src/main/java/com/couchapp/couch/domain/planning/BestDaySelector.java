package com.couchapp.couch.domain.planning;

import java.util.*;
import java.util.function.ToIntFunction;

/**
 * Greedy weekday choice for a show being promoted.
 *
 * Rules:
 * - A day is viable when its available minutes cover one episode of the show.
 * - Viable days score {@code available + GENRE_VARIETY_BONUS} when none of the show's genres is
 *   already on that day, otherwise just {@code available}. Highest score wins.
 * - With no viable day the day with the most available minutes wins, accepting an over-budget
 *   placement instead of failing.
 * - Ties always go to the lowest weekday index.
 */
public final class BestDaySelector {

    public static final int GENRE_VARIETY_BONUS = 30;

    private BestDaySelector() {}

    public static int select(int runtime,
                             Collection<String> showGenres,
                             Map<Integer, DayCapacity> capacities,
                             Map<Integer, Set<String>> genresByDay) {
        Set<String> genres = (showGenres == null) ? Set.of() : new HashSet<>(showGenres);

        List<DayCapacity> days = new ArrayList<>();
        for (int weekday = Weekdays.SUNDAY; weekday <= Weekdays.SATURDAY; weekday++) {
            DayCapacity cap = capacities.get(weekday);
            if (cap == null) {
                throw new IllegalArgumentException("capacity missing for weekday " + weekday);
            }
            days.add(cap);
        }

        List<DayCapacity> viable = days.stream()
                .filter(d -> d.fits(runtime))
                .toList();

        if (viable.isEmpty()) {
            return pickHighest(days, DayCapacity::availableMinutes);
        }

        return pickHighest(viable, d -> score(d, genres, genresByDay.getOrDefault(d.weekday(), Set.of())));
    }

    static int score(DayCapacity day, Set<String> showGenres, Set<String> dayGenres) {
        boolean overlaps = false;
        for (String g : showGenres) {
            if (dayGenres.contains(g)) {
                overlaps = true;
                break;
            }
        }
        return day.availableMinutes() + (overlaps ? 0 : GENRE_VARIETY_BONUS);
    }

    // days arrive in weekday order, so keeping the first strict maximum breaks ties by lowest index
    private static int pickHighest(List<DayCapacity> days, ToIntFunction<DayCapacity> scoreFn) {
        DayCapacity best = null;
        int bestScore = Integer.MIN_VALUE;
        for (DayCapacity d : days) {
            int s = scoreFn.applyAsInt(d);
            if (best == null || s > bestScore) {
                best = d;
                bestScore = s;
            }
        }
        return best.weekday();
    }
}
