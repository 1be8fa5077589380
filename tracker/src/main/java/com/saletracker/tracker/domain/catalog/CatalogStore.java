package com.saletracker.tracker.domain.catalog;

import com.saletracker.tracker.domain.exceptions.CatalogSyncException;
import com.saletracker.tracker.domain.exceptions.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * In-memory name/identifier catalog, rebuilt wholesale from the external source and backed by a
 * local snapshot.
 *
 * <p>Readers always see a complete catalog: a sync builds a new immutable instance and swaps it in
 * with a single volatile write. The first {@link #sync()} or {@link #restoreSnapshot()} releases
 * a one-shot initialization signal, whatever its outcome; callers that need the catalog block on
 * {@link #awaitInitialized()} instead of relying on startup ordering.
 *
 * <p>Collisions: entries are applied in page order, so a name shared by several identifiers maps
 * to the last one seen, while every identifier keeps its own name.
 */
@Slf4j
public class CatalogStore {

    private final CatalogSource source;
    private final CatalogSnapshotRepository snapshotRepository;
    private final Duration pageDelay;
    private final CountDownLatch initialized = new CountDownLatch(1);
    private final Object syncLock = new Object();

    private volatile Catalog catalog = Catalog.EMPTY;

    public CatalogStore(CatalogSource source, CatalogSnapshotRepository snapshotRepository, Duration pageDelay) {
        this.source = source;
        this.snapshotRepository = snapshotRepository;
        this.pageDelay = pageDelay == null ? Duration.ZERO : pageDelay;
    }

    /**
     * Full paginated sync. On success the new catalog replaces the current one and overwrites the
     * local snapshot. On failure, or when the source yields nothing, the current catalog is kept
     * and, if it is empty, the local snapshot is loaded instead.
     *
     * @return {@code true} when a fresh catalog from the source was applied
     */
    public boolean sync() {
        synchronized (syncLock) {
            var applied = false;
            try {
                var entries = fetchAll();
                if (entries.isEmpty()) {
                    log.warn("Catalog sync returned no entries, keeping current catalog ({} entries)", catalog.size());
                } else {
                    catalog = Catalog.of(entries);
                    applied = true;
                    log.info("Catalog sync complete: {} entries fetched, {} names indexed", entries.size(), catalog.size());
                    persistSnapshot();
                }
            } catch (CatalogSyncException e) {
                log.error("Catalog sync aborted: {}", e.getMessage(), e);
            } catch (RuntimeException e) {
                log.error("Catalog sync failed unexpectedly", e);
            } finally {
                if (catalog.isEmpty()) {
                    restoreFromSnapshot();
                }
                initialized.countDown();
            }
            return applied;
        }
    }

    /**
     * Load the local snapshot without contacting the source, unless a catalog is already present.
     *
     * @return {@code true} when the catalog is non-empty afterwards
     */
    public boolean restoreSnapshot() {
        synchronized (syncLock) {
            try {
                if (catalog.isEmpty()) {
                    restoreFromSnapshot();
                }
            } finally {
                initialized.countDown();
            }
            return !catalog.isEmpty();
        }
    }

    public Optional<String> nameOf(long appId) {
        return Optional.ofNullable(catalog.byId().get(appId));
    }

    public Optional<Long> idOf(String name) {
        return Optional.ofNullable(catalog.byName().get(name));
    }

    /** Read-only name to identifier view of the current catalog. */
    public Map<String, Long> entries() {
        return catalog.byName();
    }

    public int size() {
        return catalog.size();
    }

    public boolean isEmpty() {
        return catalog.isEmpty();
    }

    public boolean isInitialized() {
        return initialized.getCount() == 0;
    }

    /**
     * Block until the first sync or snapshot restore has finished.
     *
     * @return {@code false} if the waiting thread was interrupted
     */
    public boolean awaitInitialized() {
        try {
            initialized.await();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Block until the first sync or snapshot restore has finished, at most {@code timeout}.
     *
     * @return {@code true} if the catalog finished initializing within the timeout
     */
    public boolean awaitInitialized(Duration timeout) {
        try {
            return initialized.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private List<CatalogEntry> fetchAll() {
        var entries = new ArrayList<CatalogEntry>();
        long cursor = 0;
        var hasMore = true;
        while (hasMore) {
            var page = source.fetchPage(cursor);
            entries.addAll(page.entries());
            log.info("Fetched catalog page: cursor={}, page_entries={}, total={}",
                    cursor, page.entries().size(), entries.size());

            hasMore = page.hasMore();
            if (hasMore) {
                var next = nextCursor(page, cursor);
                if (next == cursor) {
                    throw CatalogSyncException.stalledCursor(cursor);
                }
                cursor = next;
                pause(cursor);
            }
        }
        return entries;
    }

    private long nextCursor(CatalogPage page, long cursor) {
        if (page.nextCursor() != null) {
            return page.nextCursor();
        }
        var pageEntries = page.entries();
        if (!pageEntries.isEmpty()) {
            return pageEntries.get(pageEntries.size() - 1).appId();
        }
        return cursor;
    }

    private void pause(long cursor) {
        if (pageDelay.isZero() || pageDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pageDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CatalogSyncException.interrupted(cursor, e);
        }
    }

    private void persistSnapshot() {
        try {
            snapshotRepository.save(catalog.byName());
        } catch (StorageException e) {
            log.warn("Catalog applied but the local snapshot could not be written: {}", e.getMessage());
        }
    }

    private void restoreFromSnapshot() {
        try {
            var snapshot = snapshotRepository.load();
            if (snapshot.isEmpty()) {
                log.warn("No local catalog snapshot available, catalog stays empty");
                return;
            }
            catalog = Catalog.fromSnapshot(snapshot);
            log.info("Fell back to local catalog snapshot: {} entries", catalog.size());
        } catch (RuntimeException e) {
            log.error("Local catalog snapshot could not be loaded", e);
        }
    }

    private record Catalog(Map<String, Long> byName, Map<Long, String> byId) {

        static final Catalog EMPTY = new Catalog(Map.of(), Map.of());

        static Catalog of(Collection<CatalogEntry> entries) {
            var byName = new LinkedHashMap<String, Long>();
            var byId = new HashMap<Long, String>();
            for (var entry : entries) {
                if (entry.name() == null || entry.name().isBlank()) {
                    continue;
                }
                byName.put(entry.name(), entry.appId());
                byId.put(entry.appId(), entry.name());
            }
            return new Catalog(Collections.unmodifiableMap(byName), Collections.unmodifiableMap(byId));
        }

        static Catalog fromSnapshot(Map<String, Long> snapshot) {
            var entries = new ArrayList<CatalogEntry>(snapshot.size());
            snapshot.forEach((name, appId) -> {
                if (appId != null) {
                    entries.add(new CatalogEntry(name, appId));
                }
            });
            return of(entries);
        }

        int size() {
            return byName.size();
        }

        boolean isEmpty() {
            return byName.isEmpty();
        }
    }
}
