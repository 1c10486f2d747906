package com.couchapp.couch.catalog.source;

import com.couchapp.common.exception.BadRequestException;
import com.couchapp.common.exception.CatalogUnavailableException;
import com.couchapp.common.exception.NotFoundException;
import com.couchapp.couch.catalog.model.ShowDetails;
import com.couchapp.couch.catalog.model.ShowSearchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Client for the TMDB v3 API: show search, show details and per-episode air dates.
 * Every request carries its own timeout; transport failures and non-2xx answers surface as
 * {@link CatalogUnavailableException}.
 */
@Component
public class TmdbClient {

    private static final Logger logger = LoggerFactory.getLogger(TmdbClient.class);

    private static final String TMDB_BASE_URL = "https://api.themoviedb.org/3";
    private static final String USER_AGENT = "CouchCommander/1.0";
    static final int DEFAULT_RUNTIME = 45;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    @Autowired
    public TmdbClient(
            ObjectMapper objectMapper,
            @Value("${couch.catalog.base-url:" + TMDB_BASE_URL + "}") String baseUrl,
            @Value("${couch.catalog.api-key:}") String apiKey,
            @Value("${couch.catalog.connect-timeout-seconds:5}") int connectTimeoutSeconds,
            @Value("${couch.catalog.request-timeout-seconds:10}") int requestTimeoutSeconds) {
        this(
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                objectMapper,
                baseUrl,
                apiKey,
                Duration.ofSeconds(requestTimeoutSeconds)
        );
    }

    /**
     * Constructor for testing with a custom HttpClient.
     */
    TmdbClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String apiKey, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
    }

    public List<ShowSearchResult> searchShows(String query) {
        if (query == null || query.isBlank()) {
            throw new BadRequestException("query is required");
        }

        JsonNode root = readJson(get("/search/tv", Map.of("query", query.trim())), "search");

        List<ShowSearchResult> results = new ArrayList<>();
        for (JsonNode n : root.path("results")) {
            List<Integer> genreIds = new ArrayList<>();
            for (JsonNode g : n.path("genre_ids")) {
                genreIds.add(g.asInt());
            }
            results.add(new ShowSearchResult(
                    n.path("id").asLong(),
                    n.path("name").asText(""),
                    textOrNull(n, "overview"),
                    textOrNull(n, "poster_path"),
                    textOrNull(n, "first_air_date"),
                    n.hasNonNull("vote_average") ? n.get("vote_average").asDouble() : null,
                    genreIds
            ));
        }

        logger.debug("TMDB search '{}' returned {} results", query, results.size());
        return results;
    }

    /**
     * @throws NotFoundException when TMDB has no show with this id
     */
    public ShowDetails getShowDetails(Long tmdbId) {
        Response resp = get("/tv/" + tmdbId, Map.of());
        if (resp.statusCode() == 404) {
            throw NotFoundException.show(tmdbId);
        }

        JsonNode n = readJson(resp, "show " + tmdbId);

        List<String> genres = new ArrayList<>();
        for (JsonNode g : n.path("genres")) {
            String name = g.path("name").asText("");
            if (!name.isBlank()) genres.add(name);
        }

        return new ShowDetails(
                n.path("id").asLong(tmdbId),
                n.path("name").asText(""),
                textOrNull(n, "overview"),
                textOrNull(n, "poster_path"),
                genres,
                n.path("number_of_seasons").asInt(0),
                n.path("number_of_episodes").asInt(0),
                averageRuntime(n),
                textOrNull(n, "status")
        );
    }

    /**
     * Air date of one episode, empty when TMDB does not know the episode or has no date for it.
     */
    public Optional<LocalDate> getEpisodeAirDate(Long tmdbId, int season, int episode) {
        Response resp = get("/tv/" + tmdbId + "/season/" + season + "/episode/" + episode, Map.of());
        if (resp.statusCode() == 404) {
            logger.debug("TMDB has no S{}E{} for show {}", season, episode, tmdbId);
            return Optional.empty();
        }

        JsonNode n = readJson(resp, "episode S" + season + "E" + episode + " of show " + tmdbId);
        String airDate = textOrNull(n, "air_date");
        if (airDate == null || airDate.isBlank()) return Optional.empty();

        try {
            return Optional.of(LocalDate.parse(airDate));
        } catch (DateTimeParseException e) {
            logger.warn("Unparseable air_date '{}' for show {} S{}E{}", airDate, tmdbId, season, episode);
            return Optional.empty();
        }
    }

    // -----------------------------
    // transport
    // -----------------------------

    private Response get(String path, Map<String, String> params) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new CatalogUnavailableException("TMDB API key is not configured");
        }

        StringBuilder url = new StringBuilder(baseUrl).append(path)
                .append("?api_key=").append(encode(apiKey));
        for (Map.Entry<String, String> p : params.entrySet()) {
            url.append('&').append(encode(p.getKey())).append('=').append(encode(p.getValue()));
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url.toString()))
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogUnavailableException("TMDB request interrupted", Map.of("path", path), e);
        } catch (IOException e) {
            throw new CatalogUnavailableException("TMDB request failed: " + safeMsg(e), Map.of("path", path), e);
        }

        int status = response.statusCode();
        logger.debug("TMDB GET {} -> {}", path, status);

        if (status == 404) {
            return new Response(status, null);
        }
        if (status < 200 || status >= 300) {
            throw new CatalogUnavailableException("TMDB API returned status " + status, Map.of(
                    "statusCode", status,
                    "path", path
            ));
        }

        return new Response(status, response.body());
    }

    private JsonNode readJson(Response resp, String what) {
        if (resp.body() == null) {
            throw new CatalogUnavailableException("TMDB returned no body for " + what);
        }
        try {
            return objectMapper.readTree(resp.body());
        } catch (IOException e) {
            throw new CatalogUnavailableException("Unreadable TMDB response for " + what, null, e);
        }
    }

    private static int averageRuntime(JsonNode show) {
        JsonNode runtimes = show.path("episode_run_time");
        int count = 0;
        int sum = 0;
        for (JsonNode r : runtimes) {
            if (r.asInt() > 0) {
                sum += r.asInt();
                count++;
            }
        }
        if (count > 0) {
            return (int) Math.round((double) sum / count);
        }

        int lastAired = show.path("last_episode_to_air").path("runtime").asInt(0);
        return lastAired > 0 ? lastAired : DEFAULT_RUNTIME;
    }

    private static String textOrNull(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String safeMsg(Exception e) {
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }

    private record Response(int statusCode, String body) {}
}
