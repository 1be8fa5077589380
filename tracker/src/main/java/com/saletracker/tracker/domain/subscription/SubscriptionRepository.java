package com.saletracker.tracker.domain.subscription;

import java.util.Map;

/**
 * Durable subscription document keyed by item identifier, in insertion order.
 */
public interface SubscriptionRepository {

    /** Reads the document; missing or corrupt storage is reinitialized to an empty document. */
    Map<Long, MonitoredItem> load();

    void save(Map<Long, MonitoredItem> items);
}
