package com.couchapp.couch.catalog.source;

import com.couchapp.common.exception.CatalogUnavailableException;
import com.couchapp.common.exception.NotFoundException;
import com.couchapp.couch.catalog.model.ShowDetails;
import com.couchapp.couch.catalog.model.ShowSearchResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TmdbClientTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    private TmdbClient tmdbClient;

    @BeforeEach
    void setUp() {
        tmdbClient = new TmdbClient(httpClient, new ObjectMapper(), "https://api.themoviedb.org/3", "secret",
                Duration.ofSeconds(3));
    }

    private void respond(int status, String body) throws Exception {
        doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());
        when(httpResponse.statusCode()).thenReturn(status);
        if (body != null) {
            when(httpResponse.body()).thenReturn(body);
        }
    }

    @Nested
    @DisplayName("getShowDetails")
    class ShowDetailsTests {

        @Test
        @DisplayName("maps details and averages the reported runtimes")
        void mapsDetails() throws Exception {
            respond(200, """
                {
                  "id": 1396,
                  "name": "Breaking Bad",
                  "overview": "A chemistry teacher...",
                  "poster_path": "/bb.jpg",
                  "genres": [{"id": 18, "name": "Drama"}, {"id": 80, "name": "Crime"}],
                  "number_of_seasons": 5,
                  "number_of_episodes": 62,
                  "episode_run_time": [45, 47, 0],
                  "status": "Ended"
                }
                """);

            ShowDetails details = tmdbClient.getShowDetails(1396L);

            assertThat(details.title()).isEqualTo("Breaking Bad");
            assertThat(details.genres()).containsExactly("Drama", "Crime");
            assertThat(details.totalEpisodes()).isEqualTo(62);
            assertThat(details.episodeRuntime()).isEqualTo(46);
            assertThat(details.status()).isEqualTo("Ended");
        }

        @Test
        @DisplayName("falls back to the last aired runtime, then to 45 minutes")
        void runtimeFallbacks() throws Exception {
            respond(200, """
                {"id": 1, "name": "A", "episode_run_time": [], "last_episode_to_air": {"runtime": 22}}
                """);
            assertThat(tmdbClient.getShowDetails(1L).episodeRuntime()).isEqualTo(22);

            when(httpResponse.body()).thenReturn("""
                {"id": 2, "name": "B", "episode_run_time": []}
                """);
            assertThat(tmdbClient.getShowDetails(2L).episodeRuntime()).isEqualTo(TmdbClient.DEFAULT_RUNTIME);
        }

        @Test
        void unknownShow_NotFound() throws Exception {
            respond(404, null);

            assertThatThrownBy(() -> tmdbClient.getShowDetails(5L))
                    .isInstanceOf(NotFoundException.class)
                    .satisfies(e -> assertThat(((NotFoundException) e).getErrorCode()).isEqualTo("SHOW_NOT_FOUND"));
        }

        @Test
        void serverError_Unavailable() throws Exception {
            respond(503, null);

            assertThatThrownBy(() -> tmdbClient.getShowDetails(5L))
                    .isInstanceOf(CatalogUnavailableException.class)
                    .hasMessageContaining("503");
        }
    }

    @Nested
    @DisplayName("getEpisodeAirDate")
    class AirDateTests {

        @Test
        void parsesAirDate() throws Exception {
            respond(200, """
                {"id": 62085, "season_number": 1, "episode_number": 2, "air_date": "2008-01-27"}
                """);

            assertThat(tmdbClient.getEpisodeAirDate(1396L, 1, 2)).contains(LocalDate.of(2008, 1, 27));
        }

        @Test
        void missingOrBlankDate_Empty() throws Exception {
            respond(200, """
                {"id": 1, "air_date": null}
                """);

            assertThat(tmdbClient.getEpisodeAirDate(1L, 9, 1)).isEmpty();
        }

        @Test
        void unknownEpisode_Empty() throws Exception {
            respond(404, null);

            assertThat(tmdbClient.getEpisodeAirDate(1L, 9, 9)).isEqualTo(Optional.empty());
        }

        @Test
        void requestCarriesPathKeyAndTimeout() throws Exception {
            respond(200, "{\"air_date\": \"2020-01-01\"}");

            tmdbClient.getEpisodeAirDate(42L, 3, 7);

            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(captor.capture(), any());
            HttpRequest request = captor.getValue();
            assertThat(request.uri().toString())
                    .startsWith("https://api.themoviedb.org/3/tv/42/season/3/episode/7?")
                    .contains("api_key=secret");
            assertThat(request.timeout()).contains(Duration.ofSeconds(3));
        }
    }

    @Test
    void search_ReadsResults() throws Exception {
        respond(200, """
            {"page": 1, "results": [
              {"id": 1396, "name": "Breaking Bad", "first_air_date": "2008-01-20", "vote_average": 8.9, "genre_ids": [18, 80]}
            ]}
            """);

        List<ShowSearchResult> results = tmdbClient.searchShows("breaking");

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.catalogId()).isEqualTo(1396L);
            assertThat(r.title()).isEqualTo("Breaking Bad");
            assertThat(r.genreIds()).containsExactly(18, 80);
            assertThat(r.overview()).isNull();
        });
    }

    @Test
    @DisplayName("transport errors surface as catalog unavailable")
    void ioFailure_Unavailable() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(HttpRequest.class), any());

        assertThatThrownBy(() -> tmdbClient.getEpisodeAirDate(1L, 1, 1))
                .isInstanceOf(CatalogUnavailableException.class)
                .hasMessageContaining("connection reset")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void missingApiKey_Unavailable() {
        TmdbClient unconfigured = new TmdbClient(httpClient, new ObjectMapper(), "https://api.themoviedb.org/3", "",
                Duration.ofSeconds(3));

        assertThatThrownBy(() -> unconfigured.searchShows("anything"))
                .isInstanceOf(CatalogUnavailableException.class);
        verifyNoInteractions(httpClient);
    }
}
