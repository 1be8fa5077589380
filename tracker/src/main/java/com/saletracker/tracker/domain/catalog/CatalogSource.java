package com.saletracker.tracker.domain.catalog;

import com.saletracker.tracker.domain.exceptions.CatalogSyncException;

public interface CatalogSource {

    /**
     * Fetch the page that follows {@code cursor} (0 for the first page).
     *
     * @throws CatalogSyncException on transport failure or an unexpected response shape
     */
    CatalogPage fetchPage(long cursor);
}
