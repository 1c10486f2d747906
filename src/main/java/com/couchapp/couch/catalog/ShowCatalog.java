package com.couchapp.couch.catalog;

import com.couchapp.couch.catalog.model.EpisodeAvailability;
import com.couchapp.couch.domain.show.Show;

/**
 * Read access to show metadata and episode air dates, as consumed by the scheduler.
 */
public interface ShowCatalog {

    /**
     * @throws com.couchapp.common.exception.NotFoundException when the catalog does not know the id
     * @throws com.couchapp.common.exception.CatalogUnavailableException when the catalog cannot be reached
     */
    Show getShow(Long catalogId);

    /**
     * @throws com.couchapp.common.exception.CatalogUnavailableException when the catalog cannot be reached
     */
    EpisodeAvailability isEpisodeAvailable(Long catalogId, int season, int episode);
}
