package com.saletracker.tracker.domain.poll;

import com.saletracker.common.address.ChannelKind;
import com.saletracker.common.address.SubscriberAddress;
import com.saletracker.common.event.NotificationEvent;
import com.saletracker.common.event.PriceChangeNotification;
import com.saletracker.common.event.PriceChangeType;
import com.saletracker.common.event.StoreLinks;
import com.saletracker.tracker.domain.catalog.CatalogStore;
import com.saletracker.tracker.domain.price.PriceSnapshot;
import com.saletracker.tracker.domain.price.PriceSource;
import com.saletracker.tracker.domain.subscription.MonitoredItem;
import com.saletracker.tracker.domain.subscription.SubscriptionStore;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Poll-diff-notify round over every monitored item.
 *
 * <p>A round is a lazy stream: each item is fetched and compared only when the consumer pulls
 * past the events of the previous one, so a slow consumer paces the upstream requests. The
 * comparison runs against the snapshot re-read inside the store's exclusive section, which keeps
 * overlapping rounds from reporting the same change twice.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PricePollEngine {

    private final CatalogStore catalogStore;
    private final SubscriptionStore subscriptionStore;
    private final PriceSource priceSource;
    private final PriceChangeMessageFormatter formatter;

    /** Start a new round. Nothing is fetched until the returned stream is consumed. */
    public Stream<NotificationEvent> poll() {
        var round = new PollRound();
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(round, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private List<MonitoredItem> startRound() {
        if (!catalogStore.awaitInitialized()) {
            log.warn("Interrupted while waiting for the catalog, skipping poll round");
            return List.of();
        }
        try {
            var items = subscriptionStore.listAll();
            log.info("poll.round.started: items={}", items.size());
            return items;
        } catch (RuntimeException e) {
            log.error("Could not read monitored items, poll round is empty", e);
            return List.of();
        }
    }

    private List<NotificationEvent> processSafely(MonitoredItem item) {
        try {
            return process(item);
        } catch (RuntimeException e) {
            log.error("Poll failed for {} ({}), continuing with the next item", item.name(), item.appId(), e);
            return List.of();
        }
    }

    private List<NotificationEvent> process(MonitoredItem item) {
        var fetched = priceSource.fetchPrice(item.appId(), item.region());
        if (fetched.isEmpty()) {
            log.info("No price available for {} ({}) in region {}, skipping", item.name(), item.appId(), item.region());
            return List.of();
        }
        var observation = observe(item.appId(), fetched.get());
        switch (observation.kind()) {
            case ITEM_REMOVED:
                log.info("Item {} was removed during the round, skipping", item.appId());
                return List.of();
            case BASELINE:
                log.info("price.baseline: appid={}, name={}, price={}",
                        item.appId(), item.name(), observation.current().currentPrice());
                return List.of();
            case UNCHANGED:
                log.debug("Price unchanged for {} ({})", item.name(), item.appId());
                return List.of();
            default:
                return notify(observation);
        }
    }

    private PriceObservation observe(long appId, PriceSnapshot current) {
        return subscriptionStore.withExclusiveAccess(document -> {
            var stored = document.find(appId);
            if (stored.isEmpty()) {
                return PriceObservation.removed(current);
            }
            var item = stored.get();
            if (!item.hasBaseline()) {
                var updated = item.withLastPrice(current);
                document.put(updated);
                return PriceObservation.baseline(updated, current);
            }
            var previous = item.lastPrice();
            if (current.currentPrice().compareTo(previous.currentPrice()) == 0) {
                return PriceObservation.unchanged(item, current);
            }
            var updated = item.withLastPrice(current);
            document.put(updated);
            return PriceObservation.changed(updated, previous, current);
        });
    }

    private List<NotificationEvent> notify(PriceObservation observation) {
        var item = observation.item();
        var previous = observation.previous();
        var current = observation.current();
        var delta = observation.delta();
        var changeType = classify(current, delta.signum());

        // a free snapshot carries a placeholder currency, amounts are shown in the previous one
        var currency = current.free() ? previous.currency() : current.currency();
        var payload = PriceChangeNotification.builder()
                .appId(item.appId())
                .itemName(item.name())
                .changeType(changeType)
                .previousPrice(previous.currentPrice())
                .currentPrice(current.currentPrice())
                .originalPrice(current.originalPrice())
                .priceDelta(delta)
                .discountPercent(current.discountPercent())
                .currency(currency)
                .purchaseUrl(StoreLinks.appPage(item.appId()))
                .build();
        var segments = formatter.render(payload);

        log.info("price.changed: appid={}, name={}, type={}, previous={}, current={}, subscribers={}",
                item.appId(), item.name(), changeType, previous.currentPrice(), current.currentPrice(),
                item.subscribers().size());

        return item.subscribers().stream()
                .map(subscriber -> NotificationEvent.builder()
                        .subscriberAddress(subscriber)
                        .mentionTargets(mentionTargets(subscriber))
                        .payload(payload)
                        .segments(segments)
                        .build())
                .toList();
    }

    private static PriceChangeType classify(PriceSnapshot current, int deltaSign) {
        if (current.free()) {
            return PriceChangeType.BECAME_FREE;
        }
        return deltaSign > 0 ? PriceChangeType.INCREASE : PriceChangeType.DECREASE;
    }

    private static List<String> mentionTargets(String subscriber) {
        var address = SubscriberAddress.parse(subscriber);
        if (address.kind() == ChannelKind.UNKNOWN) {
            log.warn("Unrecognized subscriber address '{}', sending without mentions", subscriber);
            return Collections.emptyList();
        }
        return address.mentionTargets();
    }

    private final class PollRound implements Iterator<NotificationEvent> {

        private final Deque<NotificationEvent> pending = new ArrayDeque<>();
        private Iterator<MonitoredItem> items;

        @Override
        public boolean hasNext() {
            if (items == null) {
                items = startRound().iterator();
            }
            while (pending.isEmpty() && items.hasNext()) {
                pending.addAll(processSafely(items.next()));
            }
            return !pending.isEmpty();
        }

        @Override
        public NotificationEvent next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }
    }
}
