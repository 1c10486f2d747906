package com.couchapp.couch.service;

import com.couchapp.common.exception.BadRequestException;
import com.couchapp.couch.domain.planning.BestDaySelector;
import com.couchapp.couch.domain.planning.DayCapacity;
import com.couchapp.couch.domain.planning.Weekdays;
import com.couchapp.couch.domain.settings.Settings;
import com.couchapp.couch.domain.show.Show;
import com.couchapp.couch.domain.watchlist.DayAssignment;
import com.couchapp.couch.domain.watchlist.WatchlistStatus;
import com.couchapp.couch.dto.days.response.DayCapacityResponse;
import com.couchapp.couch.repository.DayAssignmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Per-weekday capacity and genre bookkeeping over the shows currently being watched, and the
 * weekday choice for a show about to be promoted. Only WATCHING entries count; assignments left
 * on queued or finished entries are ignored.
 */
@Service
@RequiredArgsConstructor
public class DayAssignmentService {

    private final DayAssignmentRepository dayAssignmentRepository;
    private final TimeBudgetService timeBudgetService;

    @Transactional(readOnly = true)
    public DayCapacity dayCapacity(int weekday) {
        requireWeekday(weekday);

        int total = timeBudgetService.minutesForWeekday(weekday);
        int used = dayAssignmentRepository.findForWeekday(weekday, WatchlistStatus.WATCHING).stream()
                .mapToInt(a -> a.getWatchlistEntry().getShow().runtimeMinutes())
                .sum();

        return new DayCapacity(weekday, total, used);
    }

    @Transactional(readOnly = true)
    public Set<String> genresOnDay(int weekday) {
        requireWeekday(weekday);

        Set<String> genres = new TreeSet<>();
        for (DayAssignment a : dayAssignmentRepository.findForWeekday(weekday, WatchlistStatus.WATCHING)) {
            genres.addAll(a.getWatchlistEntry().getShow().getGenres());
        }
        return genres;
    }

    @Transactional(readOnly = true)
    public int bestDayForShow(int runtime, Collection<String> genres) {
        WeekSnapshot week = snapshot();
        return BestDaySelector.select(runtime, genres, week.capacities(), week.genres());
    }

    @Transactional(readOnly = true)
    public List<DayCapacityResponse> capacityReport() {
        WeekSnapshot week = snapshot();

        List<DayCapacityResponse> out = new ArrayList<>();
        for (int weekday = Weekdays.SUNDAY; weekday <= Weekdays.SATURDAY; weekday++) {
            DayCapacity cap = week.capacities().get(weekday);
            out.add(DayCapacityResponse.builder()
                    .weekday(weekday)
                    .totalMinutes(cap.totalMinutes())
                    .usedMinutes(cap.usedMinutes())
                    .availableMinutes(cap.availableMinutes())
                    .genres(week.genres().get(weekday))
                    .build());
        }
        return out;
    }

    /**
     * Capacities and genre sets for all seven weekdays from a single read of the watching
     * assignments and the settings row.
     */
    private WeekSnapshot snapshot() {
        Settings settings = timeBudgetService.currentSettings();

        int[] used = new int[Weekdays.COUNT];
        Map<Integer, Set<String>> genres = new HashMap<>();
        for (int d = Weekdays.SUNDAY; d <= Weekdays.SATURDAY; d++) {
            genres.put(d, new TreeSet<>());
        }

        for (DayAssignment a : dayAssignmentRepository.findAllWithStatus(WatchlistStatus.WATCHING)) {
            int weekday = a.getWeekday();
            if (!Weekdays.isValid(weekday)) continue;

            Show show = a.getWatchlistEntry().getShow();
            used[weekday] += show.runtimeMinutes();
            genres.get(weekday).addAll(show.getGenres());
        }

        Map<Integer, DayCapacity> capacities = new HashMap<>();
        for (int d = Weekdays.SUNDAY; d <= Weekdays.SATURDAY; d++) {
            capacities.put(d, new DayCapacity(d, TimeBudgetService.resolve(settings, d), used[d]));
        }

        return new WeekSnapshot(capacities, genres);
    }

    private static void requireWeekday(int weekday) {
        if (!Weekdays.isValid(weekday)) {
            throw new BadRequestException("weekday must be between 0 (Sunday) and 6 (Saturday)", "INVALID_WEEKDAY",
                    Map.of("weekday", weekday));
        }
    }

    private record WeekSnapshot(Map<Integer, DayCapacity> capacities, Map<Integer, Set<String>> genres) {}
}
