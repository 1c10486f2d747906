package com.couchapp.couch.service;

import com.couchapp.common.exception.BadRequestException;
import com.couchapp.common.exception.CatalogUnavailableException;
import com.couchapp.common.exception.NotFoundException;
import com.couchapp.couch.catalog.ShowCatalog;
import com.couchapp.couch.domain.planning.DayFiller;
import com.couchapp.couch.domain.planning.EpisodePosition;
import com.couchapp.couch.domain.planning.PlannedEpisode;
import com.couchapp.couch.domain.planning.Weekdays;
import com.couchapp.couch.domain.schedule.EpisodeStatus;
import com.couchapp.couch.domain.schedule.ScheduleDay;
import com.couchapp.couch.domain.schedule.ScheduledEpisode;
import com.couchapp.couch.domain.settings.Settings;
import com.couchapp.couch.domain.show.Show;
import com.couchapp.couch.domain.watchlist.DayAssignment;
import com.couchapp.couch.domain.watchlist.WatchlistEntry;
import com.couchapp.couch.domain.watchlist.WatchlistStatus;
import com.couchapp.couch.dto.schedule.response.DashboardResponse;
import com.couchapp.couch.dto.schedule.response.GenerateScheduleResponse;
import com.couchapp.couch.dto.schedule.response.ScheduleDayResponse;
import com.couchapp.couch.dto.schedule.response.ScheduledEpisodeResponse;
import com.couchapp.couch.repository.DayAssignmentRepository;
import com.couchapp.couch.repository.ScheduleDayRepository;
import com.couchapp.couch.repository.ScheduledEpisodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Materializes the day-by-day episode plan.
 *
 * Each date is filled by {@link DayFiller} from the WATCHING shows assigned to its weekday and
 * committed in its own transaction, together with the advanced watchlist positions. The position
 * cursor is carried across dates in memory so one generation run never re-reads its own writes.
 */
@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleDayRepository scheduleDayRepository;
    private final ScheduledEpisodeRepository scheduledEpisodeRepository;
    private final DayAssignmentRepository dayAssignmentRepository;
    private final ShowCatalog showCatalog;
    private final TimeBudgetService timeBudgetService;
    private final ScheduleInvalidationService scheduleInvalidationService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int maxGenerationDays;
    private final int horizonDays;

    public ScheduleService(ScheduleDayRepository scheduleDayRepository,
                           ScheduledEpisodeRepository scheduledEpisodeRepository,
                           DayAssignmentRepository dayAssignmentRepository,
                           ShowCatalog showCatalog,
                           TimeBudgetService timeBudgetService,
                           ScheduleInvalidationService scheduleInvalidationService,
                           PlatformTransactionManager transactionManager,
                           Clock clock,
                           @Value("${couch.schedule.max-generation-days:60}") int maxGenerationDays,
                           @Value("${couch.schedule.horizon-days:7}") int horizonDays) {
        this.scheduleDayRepository = scheduleDayRepository;
        this.scheduledEpisodeRepository = scheduledEpisodeRepository;
        this.dayAssignmentRepository = dayAssignmentRepository;
        this.showCatalog = showCatalog;
        this.timeBudgetService = timeBudgetService;
        this.scheduleInvalidationService = scheduleInvalidationService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.maxGenerationDays = maxGenerationDays;
        this.horizonDays = Math.max(1, horizonDays);
    }

    public GenerateScheduleResponse generate(LocalDate startDate, int numDays) {
        if (startDate == null) throw new BadRequestException("startDate is required");
        if (numDays < 1 || numDays > maxGenerationDays) {
            throw new BadRequestException("days must be between 1 and " + maxGenerationDays, "INVALID_RANGE",
                    Map.of("days", numDays));
        }

        LocalDate endDate = startDate.plusDays(numDays - 1L);
        Settings settings = timeBudgetService.currentSettings();

        // both modes currently fill days identically
        log.info("Generating schedule {}..{} ({} days, mode {})", startDate, endDate, numDays, settings.getSchedulingMode());

        Integer rewound = transactionTemplate.execute(tx ->
                scheduleInvalidationService.prepareRegeneration(startDate, endDate));
        if (rewound != null && rewound > 0) {
            log.debug("Rewound {} watchlist positions before regeneration", rewound);
        }

        Map<Long, EpisodePosition> cursor = new HashMap<>();
        DayFiller.AvailabilityGate gate = memoizedGate();

        List<ScheduleDayResponse> days = new ArrayList<>();
        int episodeCount = 0;
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            LocalDate current = date;
            ScheduleDayResponse day = transactionTemplate.execute(tx -> generateDay(current, settings, cursor, gate));
            days.add(day);
            episodeCount += day.getEpisodes().size();
        }

        log.info("Generated {} episodes over {} days starting {}", episodeCount, numDays, startDate);

        return GenerateScheduleResponse.builder()
                .startDate(startDate)
                .days(numDays)
                .schedulingMode(settings.getSchedulingMode())
                .episodeCount(episodeCount)
                .schedule(days)
                .build();
    }

    @Transactional(readOnly = true)
    public ScheduleDayResponse getDay(LocalDate date) {
        if (date == null) throw new BadRequestException("date is required");
        return findDay(date)
                .orElseThrow(() -> new NotFoundException("No schedule for " + date, "SCHEDULE_DAY_NOT_FOUND",
                        Map.of("date", date.toString())));
    }

    /**
     * Today's plan plus yesterday's unchecked episodes. The horizon starting today is generated
     * first when any day of it is missing.
     */
    public DashboardResponse dashboard() {
        LocalDate today = LocalDate.now(clock);
        LocalDate horizonEnd = today.plusDays(horizonDays - 1L);

        if (scheduleDayRepository.countByDateBetween(today, horizonEnd) < horizonDays) {
            generate(today, horizonDays);
        }

        LocalDate yesterday = today.minusDays(1);
        List<ScheduledEpisodeResponse> pending = scheduledEpisodeRepository
                .findByStatusBetween(EpisodeStatus.PENDING, yesterday, yesterday)
                .stream()
                .map(ScheduleService::toEpisodeResponse)
                .toList();

        return DashboardResponse.builder()
                .today(findDay(today).orElse(null))
                .yesterdayPending(pending)
                .needsCheckIn(!pending.isEmpty())
                .build();
    }

    @Transactional
    public ScheduledEpisodeResponse updateEpisodeStatus(Long episodeId, EpisodeStatus status) {
        if (episodeId == null) throw new BadRequestException("episodeId is required");
        if (status == null) throw new BadRequestException("status is required");

        ScheduledEpisode episode = scheduledEpisodeRepository.findById(episodeId)
                .orElseThrow(() -> new NotFoundException("Scheduled episode not found: " + episodeId,
                        "EPISODE_NOT_FOUND", Map.of("episodeId", episodeId)));

        episode.setStatus(status);
        ScheduledEpisode saved = scheduledEpisodeRepository.save(episode);

        log.info("Episode {} S{}E{} marked {}", saved.getShow().getTitle(), saved.getSeason(), saved.getEpisode(), status);
        return toEpisodeResponse(saved);
    }

    public void clear() {
        scheduleInvalidationService.invalidateAll();
    }

    // ---------------------------
    // Generation
    // ---------------------------

    private ScheduleDayResponse generateDay(LocalDate date,
                                            Settings settings,
                                            Map<Long, EpisodePosition> cursor,
                                            DayFiller.AvailabilityGate gate) {
        int weekday = Weekdays.of(date);
        int budget = TimeBudgetService.resolve(settings, weekday);

        List<WatchlistEntry> entries = dayAssignmentRepository
                .findForWeekday(weekday, WatchlistStatus.WATCHING)
                .stream()
                .map(DayAssignment::getWatchlistEntry)
                .toList();

        ScheduleDay day = scheduleDayRepository.findByDate(date)
                .orElseGet(() -> ScheduleDay.builder().date(date).build());
        day.setPlannedMinutes(budget);
        ScheduleDay savedDay = scheduleDayRepository.save(day);

        scheduledEpisodeRepository.deleteForDay(savedDay.getId());

        List<PlannedEpisode> planned = DayFiller.fill(budget, entries, cursor, gate);

        Map<Long, WatchlistEntry> byId = new HashMap<>();
        for (WatchlistEntry e : entries) byId.put(e.getId(), e);

        List<ScheduledEpisode> episodes = new ArrayList<>();
        for (PlannedEpisode p : planned) {
            episodes.add(ScheduledEpisode.builder()
                    .scheduleDay(savedDay)
                    .show(byId.get(p.entryId()).getShow())
                    .season(p.season())
                    .episode(p.episode())
                    .runtime(p.runtime())
                    .position(p.order())
                    .status(EpisodeStatus.PENDING)
                    .build());
        }
        List<ScheduledEpisode> saved = scheduledEpisodeRepository.saveAll(episodes);

        for (WatchlistEntry e : entries) {
            EpisodePosition pos = cursor.get(e.getId());
            if (pos == null) continue;
            e.setCurrentSeason(pos.season());
            e.setCurrentEpisode(pos.episode());
        }

        log.debug("{} ({}): {} of {} assigned shows placed, budget {} min",
                date, date.getDayOfWeek(), planned.size(), entries.size(), budget);

        return toDayResponse(savedDay, saved);
    }

    /**
     * Availability answers are reused for the rest of a generation run; a catalog failure counts as
     * not available.
     */
    private DayFiller.AvailabilityGate memoizedGate() {
        Map<String, Boolean> answers = new HashMap<>();
        return (show, season, episode) -> answers.computeIfAbsent(
                show.getCatalogId() + ":" + season + ":" + episode,
                k -> checkAvailable(show, season, episode));
    }

    private boolean checkAvailable(Show show, int season, int episode) {
        try {
            boolean available = showCatalog.isEpisodeAvailable(show.getCatalogId(), season, episode).available();
            if (!available) {
                log.debug("'{}' S{}E{} has not aired yet, skipped", show.getTitle(), season, episode);
            }
            return available;
        } catch (CatalogUnavailableException ex) {
            log.warn("Availability check for '{}' S{}E{} failed, skipping: {}",
                    show.getTitle(), season, episode, ex.getMessage());
            return false;
        }
    }

    // ---------------------------
    // Mapping
    // ---------------------------

    private Optional<ScheduleDayResponse> findDay(LocalDate date) {
        return scheduleDayRepository.findByDate(date)
                .map(day -> toDayResponse(day, scheduledEpisodeRepository.findForDay(day.getId())));
    }

    private static ScheduleDayResponse toDayResponse(ScheduleDay day, List<ScheduledEpisode> episodes) {
        List<ScheduledEpisodeResponse> items = episodes.stream()
                .sorted(Comparator.comparing(ScheduledEpisode::getPosition))
                .map(ScheduleService::toEpisodeResponse)
                .toList();

        int scheduled = episodes.stream().mapToInt(ScheduledEpisode::getRuntime).sum();

        return ScheduleDayResponse.builder()
                .id(day.getId())
                .date(day.getDate())
                .weekday(Weekdays.of(day.getDate()))
                .plannedMinutes(day.getPlannedMinutes())
                .scheduledMinutes(scheduled)
                .episodes(items)
                .build();
    }

    private static ScheduledEpisodeResponse toEpisodeResponse(ScheduledEpisode e) {
        Show show = e.getShow();
        return ScheduledEpisodeResponse.builder()
                .id(e.getId())
                .showId(show.getId())
                .catalogId(show.getCatalogId())
                .title(show.getTitle())
                .season(e.getSeason())
                .episode(e.getEpisode())
                .runtime(e.getRuntime())
                .order(e.getPosition())
                .status(e.getStatus())
                .build();
    }
}
