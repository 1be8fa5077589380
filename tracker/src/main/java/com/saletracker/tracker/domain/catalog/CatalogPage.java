package com.saletracker.tracker.domain.catalog;

import java.util.List;

/**
 * One page of the external catalog.
 *
 * @param nextCursor continuation token reported by the source, {@code null} when absent
 */
public record CatalogPage(List<CatalogEntry> entries, boolean hasMore, Long nextCursor) {

    public CatalogPage {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
