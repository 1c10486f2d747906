package com.couchapp.couch.catalog;

import com.couchapp.couch.catalog.model.EpisodeAvailability;
import com.couchapp.couch.catalog.model.ShowDetails;
import com.couchapp.couch.catalog.model.ShowSearchResult;
import com.couchapp.couch.catalog.source.TmdbClient;
import com.couchapp.couch.domain.show.Show;
import com.couchapp.couch.domain.show.ShowLifecycle;
import com.couchapp.couch.repository.ShowRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * TMDB-backed catalog with a relational cache of show metadata. Shows are fetched once and
 * served from the {@code tv_show} table afterwards; {@link #cacheShow(Long)} refreshes a row.
 * Air dates are always asked live.
 */
@Service
@RequiredArgsConstructor
public class ShowCatalogService implements ShowCatalog {

    private static final Logger log = LoggerFactory.getLogger(ShowCatalogService.class);

    private final ShowRepository showRepository;
    private final TmdbClient tmdbClient;
    private final Clock clock;

    @Override
    @Transactional
    public Show getShow(Long catalogId) {
        return showRepository.findByCatalogId(catalogId)
                .orElseGet(() -> cacheShow(catalogId));
    }

    @Transactional
    public Show cacheShow(Long catalogId) {
        ShowDetails details = tmdbClient.getShowDetails(catalogId);

        Show show = showRepository.findByCatalogId(catalogId)
                .orElseGet(() -> Show.builder().catalogId(catalogId).build());

        show.setTitle(details.title());
        show.setOverview(details.overview());
        show.setPosterPath(details.posterPath());
        show.setGenres(new ArrayList<>(details.genres()));
        show.setTotalSeasons(details.totalSeasons());
        show.setTotalEpisodes(details.totalEpisodes());
        show.setEpisodeRuntime(details.episodeRuntime());
        show.setCatalogStatus(details.status());
        show.setLifecycle(ShowLifecycle.fromCatalogStatus(details.status()));

        Show saved = showRepository.save(show);
        log.info("Cached show {} '{}' ({} episodes, {} min, {})",
                catalogId, saved.getTitle(), saved.getTotalEpisodes(), saved.getEpisodeRuntime(), saved.getLifecycle());
        return saved;
    }

    @Override
    public EpisodeAvailability isEpisodeAvailable(Long catalogId, int season, int episode) {
        Optional<LocalDate> airDate = tmdbClient.getEpisodeAirDate(catalogId, season, episode);
        if (airDate.isEmpty()) {
            return EpisodeAvailability.unavailable(null);
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate date = airDate.get();
        return date.isAfter(today)
                ? EpisodeAvailability.unavailable(date)
                : new EpisodeAvailability(true, date);
    }

    public List<ShowSearchResult> search(String query) {
        return tmdbClient.searchShows(query);
    }
}
