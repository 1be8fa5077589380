package com.saletracker.tracker.domain.subscription;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable working copy of the subscription document, handed out only inside
 * {@link SubscriptionStore#withExclusiveAccess}. Tracks whether anything changed so the store
 * persists only real modifications.
 */
public class SubscriptionDocument {

    private final LinkedHashMap<Long, MonitoredItem> items = new LinkedHashMap<>();
    private boolean dirty;

    SubscriptionDocument(Map<Long, MonitoredItem> loaded) {
        loaded.forEach((appId, item) -> {
            if (item != null && item.hasSubscribers()) {
                items.put(appId, item);
            } else {
                dirty = true;
            }
        });
    }

    public Optional<MonitoredItem> find(long appId) {
        return Optional.ofNullable(items.get(appId));
    }

    /** Insert or replace; an item without subscribers is removed instead. */
    public void put(MonitoredItem item) {
        if (!item.hasSubscribers()) {
            remove(item.appId());
            return;
        }
        items.put(item.appId(), item);
        dirty = true;
    }

    public boolean remove(long appId) {
        var removed = items.remove(appId) != null;
        dirty |= removed;
        return removed;
    }

    public List<MonitoredItem> items() {
        return List.copyOf(items.values());
    }

    public int size() {
        return items.size();
    }

    public boolean isDirty() {
        return dirty;
    }

    Map<Long, MonitoredItem> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }
}
