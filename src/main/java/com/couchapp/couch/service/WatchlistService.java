package com.couchapp.couch.service;

import com.couchapp.common.exception.BadRequestException;
import com.couchapp.common.exception.CatalogUnavailableException;
import com.couchapp.common.exception.InvalidTransitionException;
import com.couchapp.common.exception.NotFoundException;
import com.couchapp.common.exception.NotYetAvailableException;
import com.couchapp.couch.catalog.ShowCatalog;
import com.couchapp.couch.catalog.model.EpisodeAvailability;
import com.couchapp.couch.domain.planning.QueueCandidateSelector;
import com.couchapp.couch.domain.planning.Weekdays;
import com.couchapp.couch.domain.show.Show;
import com.couchapp.couch.domain.watchlist.WatchlistEntry;
import com.couchapp.couch.domain.watchlist.WatchlistStatus;
import com.couchapp.couch.dto.watchlist.request.*;
import com.couchapp.couch.dto.watchlist.response.FinishEntryResponse;
import com.couchapp.couch.dto.watchlist.response.QueueAvailabilityResponse;
import com.couchapp.couch.dto.watchlist.response.WatchlistEntryResponse;
import com.couchapp.couch.repository.WatchlistEntryRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Watchlist bookkeeping and the queue state machine.
 *
 * QUEUED -> WATCHING via {@link #promote}, WATCHING -> QUEUED via {@link #demote}, any status ->
 * FINISHED (or back to QUEUED for a series still airing) via {@link #finish}. Every change that
 * affects what gets scheduled drops the generated schedule first.
 */
@Service
@RequiredArgsConstructor
public class WatchlistService {

    private static final Logger log = LoggerFactory.getLogger(WatchlistService.class);

    private final WatchlistEntryRepository watchlistEntryRepository;
    private final ShowCatalog showCatalog;
    private final DayAssignmentService dayAssignmentService;
    private final ScheduleInvalidationService scheduleInvalidationService;

    @Transactional(readOnly = true)
    public List<WatchlistEntryResponse> list() {
        return watchlistEntryRepository.findAllByOrderByPriorityAscIdAsc().stream()
                .map(WatchlistEntryResponse::of)
                .toList();
    }

    @Transactional(readOnly = true)
    public WatchlistEntryResponse get(Long entryId) {
        return WatchlistEntryResponse.of(findEntry(entryId));
    }

    @Transactional
    public WatchlistEntryResponse follow(FollowShowRequest request) {
        Long catalogId = request.getCatalogId();
        if (catalogId == null) throw new BadRequestException("catalogId is required");

        Show show = showCatalog.getShow(catalogId);

        if (watchlistEntryRepository.existsByShow_Id(show.getId())) {
            throw new BadRequestException("Show is already on the watchlist: " + show.getTitle(), "DUPLICATE_ENTRY",
                    Map.of("catalogId", catalogId));
        }

        int startSeason = positiveOrDefault(request.getStartSeason(), "startSeason");
        int startEpisode = positiveOrDefault(request.getStartEpisode(), "startEpisode");

        WatchlistEntry entry = WatchlistEntry.builder()
                .show(show)
                .priority(request.getPriority() == null ? 0 : request.getPriority())
                .startSeason(startSeason)
                .startEpisode(startEpisode)
                .currentSeason(startSeason)
                .currentEpisode(startEpisode)
                .modeOverride(request.getModeOverride())
                .build();

        WatchlistEntry saved = watchlistEntryRepository.save(entry);
        log.info("Followed '{}' as entry {} starting S{}E{}", show.getTitle(), saved.getId(), startSeason, startEpisode);
        return WatchlistEntryResponse.of(saved);
    }

    @Transactional
    public Long unfollow(Long entryId) {
        WatchlistEntry entry = findEntry(entryId);

        scheduleInvalidationService.invalidateAll();
        watchlistEntryRepository.delete(entry);

        log.info("Unfollowed '{}' (entry {})", entry.getShow().getTitle(), entryId);
        return entryId;
    }

    @Transactional
    public List<WatchlistEntryResponse> reorder(List<Long> orderedIds) {
        if (orderedIds == null || orderedIds.isEmpty()) throw new BadRequestException("orderedIds is required");
        if (new HashSet<>(orderedIds).size() != orderedIds.size()) {
            throw new BadRequestException("orderedIds contains duplicates", "DUPLICATE_ID", null);
        }

        List<WatchlistEntry> entries = new ArrayList<>();
        for (Long id : orderedIds) {
            entries.add(findEntry(id));
        }

        scheduleInvalidationService.invalidateAll();

        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).setPriority(i);
        }
        watchlistEntryRepository.saveAll(entries);

        return list();
    }

    @Transactional
    public WatchlistEntryResponse updateProgress(UpdateProgressRequest request) {
        WatchlistEntry entry = findEntry(request.getEntryId());

        int season = positiveOrDefault(request.getSeason(), "season");
        int episode = positiveOrDefault(request.getEpisode(), "episode");

        scheduleInvalidationService.invalidateAll();

        entry.setCurrentSeason(season);
        entry.setCurrentEpisode(episode);
        return WatchlistEntryResponse.of(watchlistEntryRepository.save(entry));
    }

    /**
     * Direct status change, mainly for dropping a show. Entering WATCHING is only possible through
     * {@link #promote} since it needs the availability check and a weekday.
     */
    @Transactional
    public WatchlistEntryResponse updateStatus(UpdateStatusRequest request) {
        WatchlistEntry entry = findEntry(request.getEntryId());
        WatchlistStatus target = request.getStatus();
        if (target == null) throw new BadRequestException("status is required");

        if (target == WatchlistStatus.WATCHING && !entry.isWatching()) {
            throw new InvalidTransitionException(entry.getId(), entry.getStatus().name(), "status",
                    "Use promote to start watching a show");
        }
        if (target == entry.getStatus()) {
            return WatchlistEntryResponse.of(entry);
        }

        scheduleInvalidationService.invalidateAll();

        entry.clearWeekdays();
        entry.setStatus(target);

        WatchlistEntry saved = watchlistEntryRepository.save(entry);
        log.info("Entry {} status set to {}", saved.getId(), target);
        return WatchlistEntryResponse.of(saved);
    }

    @Transactional
    public WatchlistEntryResponse promote(Long entryId) {
        return WatchlistEntryResponse.of(doPromote(findEntry(entryId)));
    }

    @Transactional
    public WatchlistEntryResponse demote(Long entryId) {
        WatchlistEntry entry = findEntry(entryId);
        if (!entry.isWatching()) {
            throw new InvalidTransitionException(entry.getId(), entry.getStatus().name(), "demote",
                    "Only shows being watched can be moved back to the queue");
        }

        scheduleInvalidationService.invalidateAll();

        entry.clearWeekdays();
        entry.setStatus(WatchlistStatus.QUEUED);

        WatchlistEntry saved = watchlistEntryRepository.save(entry);
        log.info("Demoted '{}' (entry {}) to the queue", saved.getShow().getTitle(), saved.getId());
        return WatchlistEntryResponse.of(saved);
    }

    @Transactional
    public FinishEntryResponse finish(Long entryId, boolean autoPromote) {
        WatchlistEntry entry = findEntry(entryId);
        Show show = entry.getShow();
        int freedRuntime = show.runtimeMinutes();

        scheduleInvalidationService.invalidateAll();

        entry.clearWeekdays();

        // a series still airing waits in the queue for new episodes
        boolean movedToQueue = show.isOngoing();
        entry.setStatus(movedToQueue ? WatchlistStatus.QUEUED : WatchlistStatus.FINISHED);

        WatchlistEntry saved = watchlistEntryRepository.save(entry);
        log.info("Finished '{}' (entry {}), {}", show.getTitle(), saved.getId(),
                movedToQueue ? "back in queue until new episodes air" : "marked FINISHED");

        WatchlistEntry promoted = autoPromote ? promoteReplacement(saved.getId(), freedRuntime) : null;

        return FinishEntryResponse.builder()
                .finishedEntry(WatchlistEntryResponse.of(saved))
                .movedToQueue(movedToQueue)
                .promotedEntry(promoted == null ? null : WatchlistEntryResponse.of(promoted))
                .build();
    }

    /**
     * Replaces the assignment set with exactly {@code weekdays}, for any status. Values outside
     * 0..6 and duplicates are dropped.
     */
    @Transactional
    public WatchlistEntryResponse setWeekdays(Long entryId, Collection<Integer> weekdays) {
        WatchlistEntry entry = findEntry(entryId);
        Set<Integer> days = Weekdays.sanitize(weekdays);

        scheduleInvalidationService.invalidateAll();

        entry.replaceWeekdays(days);

        WatchlistEntry saved = watchlistEntryRepository.save(entry);
        log.info("Entry {} assigned to weekdays {}", saved.getId(), days);
        return WatchlistEntryResponse.of(saved);
    }

    /**
     * Whether each queued show could be promoted right now. Ended shows need no catalog lookup; a
     * catalog failure reports the show as unavailable.
     */
    @Transactional(readOnly = true)
    public List<QueueAvailabilityResponse> queueAvailability() {
        List<QueueAvailabilityResponse> out = new ArrayList<>();

        for (WatchlistEntry entry : watchlistEntryRepository.findByStatusOrderByPriorityAscIdAsc(WatchlistStatus.QUEUED)) {
            Show show = entry.getShow();
            EpisodeAvailability availability;

            if (!show.isOngoing()) {
                availability = EpisodeAvailability.availableNow();
            } else {
                try {
                    availability = showCatalog.isEpisodeAvailable(show.getCatalogId(),
                            entry.getCurrentSeason(), entry.getCurrentEpisode());
                } catch (CatalogUnavailableException ex) {
                    log.warn("Availability of '{}' unknown: {}", show.getTitle(), ex.getMessage());
                    availability = EpisodeAvailability.unavailable(null);
                }
            }

            out.add(QueueAvailabilityResponse.builder()
                    .entryId(entry.getId())
                    .title(show.getTitle())
                    .available(availability.available())
                    .airDate(availability.airDate())
                    .build());
        }
        return out;
    }

    // ---------------------------
    // Promotion
    // ---------------------------

    /**
     * All checks run before anything is written, so a refused promotion leaves the entry and the
     * schedule untouched.
     */
    private WatchlistEntry doPromote(WatchlistEntry entry) {
        if (!entry.isQueued()) {
            throw new InvalidTransitionException(entry.getId(), entry.getStatus().name(), "promote",
                    "Only queued shows can be promoted");
        }

        Show show = entry.getShow();
        if (show.isOngoing()) {
            EpisodeAvailability availability = showCatalog.isEpisodeAvailable(show.getCatalogId(),
                    entry.getCurrentSeason(), entry.getCurrentEpisode());
            if (!availability.available()) {
                throw new NotYetAvailableException(entry.getId(), availability.airDate());
            }
        }

        int weekday = dayAssignmentService.bestDayForShow(show.runtimeMinutes(), show.getGenres());

        scheduleInvalidationService.invalidateAll();

        entry.replaceWeekdays(List.of(weekday));
        entry.setStatus(WatchlistStatus.WATCHING);

        WatchlistEntry saved = watchlistEntryRepository.save(entry);
        log.info("Promoted '{}' (entry {}) to weekday {}", show.getTitle(), saved.getId(), weekday);
        return saved;
    }

    private WatchlistEntry promoteReplacement(Long finishedId, int freedRuntime) {
        List<WatchlistEntry> queued = watchlistEntryRepository
                .findByStatusOrderByPriorityAscIdAsc(WatchlistStatus.QUEUED)
                .stream()
                .filter(e -> !Objects.equals(e.getId(), finishedId))
                .toList();

        Optional<WatchlistEntry> candidate = QueueCandidateSelector.pick(queued, freedRuntime);
        if (candidate.isEmpty()) {
            log.debug("No queued show to take over {} freed minutes", freedRuntime);
            return null;
        }

        WatchlistEntry next = candidate.get();
        try {
            return doPromote(next);
        } catch (NotYetAvailableException | CatalogUnavailableException ex) {
            log.info("Auto-promotion of entry {} skipped: {}", next.getId(), ex.getMessage());
            return null;
        }
    }

    // ---------------------------
    // Helpers
    // ---------------------------

    private WatchlistEntry findEntry(Long entryId) {
        if (entryId == null) throw new BadRequestException("entryId is required");
        return watchlistEntryRepository.findById(entryId)
                .orElseThrow(() -> NotFoundException.entry(entryId));
    }

    private static int positiveOrDefault(Integer value, String field) {
        if (value == null) return 1;
        if (value < 1) {
            throw new BadRequestException(field + " must be at least 1", "BAD_REQUEST", Map.of(field, value));
        }
        return value;
    }
}
