package com.couchapp.couch.catalog;

import com.couchapp.couch.catalog.model.EpisodeAvailability;
import com.couchapp.couch.catalog.model.ShowDetails;
import com.couchapp.couch.catalog.source.TmdbClient;
import com.couchapp.couch.domain.show.Show;
import com.couchapp.couch.domain.show.ShowLifecycle;
import com.couchapp.couch.repository.ShowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShowCatalogServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 18);

    @Mock
    private ShowRepository showRepository;

    @Mock
    private TmdbClient tmdbClient;

    private ShowCatalogService showCatalogService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        showCatalogService = new ShowCatalogService(showRepository, tmdbClient, clock);
    }

    @Nested
    @DisplayName("getShow")
    class GetShowTests {

        @Test
        @DisplayName("serves a cached show without calling TMDB")
        void cached_NoRemoteCall() {
            Show cached = Show.builder().id(1L).catalogId(1396L).title("Breaking Bad").build();
            when(showRepository.findByCatalogId(1396L)).thenReturn(Optional.of(cached));

            assertThat(showCatalogService.getShow(1396L)).isSameAs(cached);
            verifyNoInteractions(tmdbClient);
        }

        @Test
        @DisplayName("fetches and stores a show on a cache miss")
        void miss_FetchesAndCaches() {
            when(showRepository.findByCatalogId(1399L)).thenReturn(Optional.empty());
            when(tmdbClient.getShowDetails(1399L)).thenReturn(new ShowDetails(1399L, "Game of Thrones", "Seven kingdoms",
                    "/got.jpg", List.of("Drama", "Sci-Fi & Fantasy"), 8, 73, 58, "Ended"));
            when(showRepository.save(any(Show.class))).thenAnswer(inv -> inv.getArgument(0));

            Show show = showCatalogService.getShow(1399L);

            assertThat(show.getCatalogId()).isEqualTo(1399L);
            assertThat(show.getTitle()).isEqualTo("Game of Thrones");
            assertThat(show.getGenres()).containsExactly("Drama", "Sci-Fi & Fantasy");
            assertThat(show.getTotalEpisodes()).isEqualTo(73);
            assertThat(show.getEpisodeRuntime()).isEqualTo(58);
            assertThat(show.getLifecycle()).isEqualTo(ShowLifecycle.ENDED);
        }
    }

    @Test
    @DisplayName("refreshing updates the existing row in place")
    void cacheShow_UpdatesExisting() {
        Show existing = Show.builder().id(4L).catalogId(100L).title("Old").lifecycle(ShowLifecycle.ENDED).build();
        when(tmdbClient.getShowDetails(100L)).thenReturn(new ShowDetails(100L, "New", null, null, List.of(),
                2, 20, 30, "Returning Series"));
        when(showRepository.findByCatalogId(100L)).thenReturn(Optional.of(existing));
        when(showRepository.save(existing)).thenReturn(existing);

        Show refreshed = showCatalogService.cacheShow(100L);

        assertThat(refreshed.getId()).isEqualTo(4L);
        assertThat(refreshed.getTitle()).isEqualTo("New");
        assertThat(refreshed.isOngoing()).isTrue();
    }

    @Nested
    @DisplayName("isEpisodeAvailable")
    class AvailabilityTests {

        @Test
        void airedToday_Available() {
            when(tmdbClient.getEpisodeAirDate(1L, 2, 3)).thenReturn(Optional.of(TODAY));

            EpisodeAvailability availability = showCatalogService.isEpisodeAvailable(1L, 2, 3);

            assertThat(availability.available()).isTrue();
            assertThat(availability.airDate()).isEqualTo(TODAY);
        }

        @Test
        void futureDate_UnavailableWithDate() {
            when(tmdbClient.getEpisodeAirDate(1L, 2, 4)).thenReturn(Optional.of(TODAY.plusDays(7)));

            EpisodeAvailability availability = showCatalogService.isEpisodeAvailable(1L, 2, 4);

            assertThat(availability.available()).isFalse();
            assertThat(availability.airDate()).isEqualTo(TODAY.plusDays(7));
        }

        @Test
        void unknownDate_UnavailableWithoutDate() {
            when(tmdbClient.getEpisodeAirDate(1L, 3, 1)).thenReturn(Optional.empty());

            assertThat(showCatalogService.isEpisodeAvailable(1L, 3, 1))
                    .isEqualTo(EpisodeAvailability.unavailable(null));
        }
    }
}
