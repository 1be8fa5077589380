package com.saletracker.tracker.domain.catalog;

import java.util.Map;

/**
 * Durable name to identifier snapshot of the last successful catalog sync.
 */
public interface CatalogSnapshotRepository {

    /** Returns the persisted snapshot, or an empty map when it is missing or unreadable. */
    Map<String, Long> load();

    void save(Map<String, Long> snapshot);
}
