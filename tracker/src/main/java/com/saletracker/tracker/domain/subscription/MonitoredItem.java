package com.saletracker.tracker.domain.subscription;

import com.saletracker.tracker.domain.price.PriceSnapshot;
import lombok.Builder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A catalog item with at least one subscriber.
 *
 * @param lastPrice   last observed snapshot, {@code null} until the first successful poll
 * @param subscribers raw subscriber addresses in subscription order, without duplicates
 */
@Builder(toBuilder = true)
public record MonitoredItem(
        long appId,
        String name,
        String region,
        PriceSnapshot lastPrice,
        List<String> subscribers
) {

    public MonitoredItem {
        subscribers = subscribers == null
                ? List.of()
                : subscribers.stream().filter(Objects::nonNull).distinct().toList();
    }

    public static MonitoredItem create(long appId, String name, String region) {
        return new MonitoredItem(appId, name, region, null, List.of());
    }

    public boolean hasBaseline() {
        return lastPrice != null;
    }

    public boolean hasSubscribers() {
        return !subscribers.isEmpty();
    }

    public boolean isSubscribed(String subscriber) {
        return subscribers.contains(subscriber);
    }

    public MonitoredItem withSubscriber(String subscriber) {
        if (isSubscribed(subscriber)) {
            return this;
        }
        var updated = new ArrayList<>(subscribers);
        updated.add(subscriber);
        return toBuilder().subscribers(updated).build();
    }

    public MonitoredItem withoutSubscriber(String subscriber) {
        var updated = new ArrayList<>(subscribers);
        updated.remove(subscriber);
        return toBuilder().subscribers(updated).build();
    }

    public MonitoredItem withLastPrice(PriceSnapshot snapshot) {
        return toBuilder().lastPrice(snapshot).build();
    }
}
