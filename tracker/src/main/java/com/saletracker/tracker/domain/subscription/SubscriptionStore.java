package com.saletracker.tracker.domain.subscription;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Process-wide owner of the subscription document.
 *
 * <p>Every read-modify-write-persist unit runs under one lock: the document is read from the
 * repository on entry and written back before the lock is released, so command handlers and the
 * poll engine never interleave their updates and never observe a half-applied change.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionStore {

    private final SubscriptionRepository repository;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile int monitoredCount;

    public Map<Long, MonitoredItem> load() {
        return withExclusiveAccess(SubscriptionDocument::asMap);
    }

    /**
     * Run {@code operation} with exclusive access to the full document. Changes are persisted
     * before the lock is released; if {@code operation} throws, nothing is persisted.
     */
    public <T> T withExclusiveAccess(Function<SubscriptionDocument, T> operation) {
        lock.lock();
        try {
            var document = new SubscriptionDocument(repository.load());
            var result = operation.apply(document);
            if (document.isDirty()) {
                repository.save(document.asMap());
            }
            monitoredCount = document.size();
            return result;
        } finally {
            lock.unlock();
        }
    }

    public SubscribeOutcome subscribe(long appId, String name, String region, String subscriber) {
        return withExclusiveAccess(document -> {
            var item = document.find(appId).orElseGet(() -> MonitoredItem.create(appId, name, region));
            if (item.isSubscribed(subscriber)) {
                return SubscribeOutcome.ALREADY_SUBSCRIBED;
            }
            document.put(item.withSubscriber(subscriber));
            log.info("subscription.added: appid={}, name={}, subscriber={}", appId, item.name(), subscriber);
            return SubscribeOutcome.NEWLY_SUBSCRIBED;
        });
    }

    public UnsubscribeOutcome unsubscribe(long appId, String subscriber) {
        return withExclusiveAccess(document -> {
            var existing = document.find(appId);
            if (existing.isEmpty()) {
                return UnsubscribeOutcome.NOT_MONITORED;
            }
            var item = existing.get();
            if (!item.isSubscribed(subscriber)) {
                return UnsubscribeOutcome.NOT_SUBSCRIBED;
            }
            var updated = item.withoutSubscriber(subscriber);
            document.put(updated);
            log.info("subscription.removed: appid={}, name={}, subscriber={}", appId, item.name(), subscriber);
            if (!updated.hasSubscribers()) {
                log.info("Item {} ({}) has no subscribers left, no longer monitored", item.name(), appId);
            }
            return UnsubscribeOutcome.REMOVED;
        });
    }

    public List<MonitoredItem> listByAddress(String subscriber) {
        return withExclusiveAccess(document -> document.items().stream()
                .filter(item -> item.isSubscribed(subscriber))
                .toList());
    }

    public List<MonitoredItem> listAll() {
        return withExclusiveAccess(SubscriptionDocument::items);
    }

    public Optional<MonitoredItem> find(long appId) {
        return withExclusiveAccess(document -> document.find(appId));
    }

    /** Item count observed by the most recent access; no I/O. */
    public int monitoredCount() {
        return monitoredCount;
    }

    /** Reads the document once so {@link #monitoredCount()} reflects storage before any other access. */
    public int refreshMonitoredCount() {
        return withExclusiveAccess(SubscriptionDocument::size);
    }
}
