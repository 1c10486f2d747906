package com.couchapp.couch;

import com.couchapp.common.exception.NotFoundException;
import com.couchapp.couch.catalog.model.ShowDetails;
import com.couchapp.couch.catalog.source.TmdbClient;
import com.couchapp.couch.domain.watchlist.WatchlistStatus;
import com.couchapp.couch.dto.schedule.response.GenerateScheduleResponse;
import com.couchapp.couch.dto.schedule.response.ScheduleDayResponse;
import com.couchapp.couch.dto.schedule.response.ScheduledEpisodeResponse;
import com.couchapp.couch.dto.watchlist.request.FollowShowRequest;
import com.couchapp.couch.dto.watchlist.response.FinishEntryResponse;
import com.couchapp.couch.dto.watchlist.response.WatchlistEntryResponse;
import com.couchapp.couch.repository.ScheduleDayRepository;
import com.couchapp.couch.repository.ScheduledEpisodeRepository;
import com.couchapp.couch.repository.ShowRepository;
import com.couchapp.couch.repository.WatchlistEntryRepository;
import com.couchapp.couch.service.ScheduleService;
import com.couchapp.couch.service.WatchlistService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * Watchlist and schedule services against the in-memory database, with TMDB replaced by a mock.
 */
@SpringBootTest
class ScheduleFlowIntegrationTest {

    private static final LocalDate MONDAY = LocalDate.of(2026, 10, 19);

    @Autowired
    private WatchlistService watchlistService;

    @Autowired
    private ScheduleService scheduleService;

    @Autowired
    private ScheduledEpisodeRepository scheduledEpisodeRepository;

    @Autowired
    private ScheduleDayRepository scheduleDayRepository;

    @Autowired
    private WatchlistEntryRepository watchlistEntryRepository;

    @Autowired
    private ShowRepository showRepository;

    @MockBean
    private TmdbClient tmdbClient;

    @BeforeEach
    void cleanDatabase() {
        scheduledEpisodeRepository.deleteAllInBatch();
        scheduleDayRepository.deleteAllInBatch();
        watchlistEntryRepository.deleteAll();
        showRepository.deleteAll();

        when(tmdbClient.getShowDetails(100L)).thenReturn(new ShowDetails(100L, "Slow Burn", null, null,
                List.of("Drama"), 1, 10, 47, "Ended"));
        when(tmdbClient.getShowDetails(200L)).thenReturn(new ShowDetails(200L, "Sitcom", null, null,
                List.of("Comedy"), 1, 8, 22, "Ended"));
    }

    @Test
    @DisplayName("follow, promote, generate twice, then finish with auto-promotion")
    void fullFlow() {
        WatchlistEntryResponse drama = watchlistService.follow(FollowShowRequest.builder().catalogId(100L).build());
        WatchlistEntryResponse sitcom = watchlistService.follow(FollowShowRequest.builder().catalogId(200L).build());

        WatchlistEntryResponse promoted = watchlistService.promote(drama.getId());
        assertThat(promoted.getStatus()).isEqualTo(WatchlistStatus.WATCHING);
        // empty week with default budgets: Sunday and Saturday tie, lowest index wins
        assertThat(promoted.getWeekdays()).containsExactly(0);

        watchlistService.setWeekdays(drama.getId(), List.of(1));
        // stale assignment on a queued show must not be scheduled
        watchlistService.setWeekdays(sitcom.getId(), List.of(1));

        GenerateScheduleResponse first = scheduleService.generate(MONDAY, 7);
        GenerateScheduleResponse second = scheduleService.generate(MONDAY, 7);

        assertThat(first.getEpisodeCount()).isEqualTo(1);
        assertThat(episodesOf(second.getSchedule().get(0)))
                .isEqualTo(episodesOf(first.getSchedule().get(0)))
                .containsExactly("Slow Burn S1E1");
        assertThat(watchlistService.get(drama.getId()).getCurrentEpisode()).isEqualTo(2);

        ScheduleDayResponse monday = scheduleService.getDay(MONDAY);
        assertThat(monday.getPlannedMinutes()).isEqualTo(120);
        assertThat(monday.getScheduledMinutes()).isEqualTo(47);

        FinishEntryResponse finished = watchlistService.finish(drama.getId(), true);

        assertThat(finished.isMovedToQueue()).isFalse();
        assertThat(finished.getFinishedEntry().getStatus()).isEqualTo(WatchlistStatus.FINISHED);
        assertThat(finished.getPromotedEntry().getId()).isEqualTo(sitcom.getId());
        assertThat(finished.getPromotedEntry().getWeekdays()).containsExactly(0);

        assertThatThrownBy(() -> scheduleService.getDay(MONDAY)).isInstanceOf(NotFoundException.class);
    }

    private static List<String> episodesOf(ScheduleDayResponse day) {
        return day.getEpisodes().stream()
                .map((ScheduledEpisodeResponse e) -> e.getTitle() + " S" + e.getSeason() + "E" + e.getEpisode())
                .toList();
    }
}
