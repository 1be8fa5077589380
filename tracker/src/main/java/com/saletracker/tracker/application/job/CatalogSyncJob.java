package com.saletracker.tracker.application.job;

import com.saletracker.tracker.application.config.TrackerProperties;
import com.saletracker.tracker.domain.catalog.CatalogStore;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogSyncJob {

    private final CatalogStore catalogStore;
    private final TrackerProperties properties;
    private final Counter catalogSyncsCounter;

    /** First load, off the startup thread; commands wait on the catalog's ready signal meanwhile. */
    @Async
    @EventListener(ApplicationReadyEvent.class)
    public void initialLoad() {
        if (!properties.catalog().syncOnStartup()) {
            var restored = catalogStore.restoreSnapshot();
            log.info("Startup catalog sync disabled, restored local snapshot: available={}, entries={}",
                    restored, catalogStore.size());
            return;
        }
        sync("startup");
    }

    @Scheduled(
            fixedDelayString = "${tracker.catalog.refresh-interval}",
            initialDelayString = "${tracker.catalog.refresh-interval}")
    public void refresh() {
        sync("refresh");
    }

    private void sync(String trigger) {
        log.info("catalog.sync.begin: trigger={}", trigger);
        if (catalogStore.sync()) {
            catalogSyncsCounter.increment();
        }
        log.info("catalog.sync.end: trigger={}, entries={}", trigger, catalogStore.size());
    }
}
