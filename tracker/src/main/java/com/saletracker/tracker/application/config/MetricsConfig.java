package com.saletracker.tracker.application.config;

import com.saletracker.tracker.domain.catalog.CatalogStore;
import com.saletracker.tracker.domain.exceptions.StorageException;
import com.saletracker.tracker.domain.subscription.SubscriptionStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MetricsConfig {

    @Bean
    public Counter pollRoundsCounter(MeterRegistry registry) {
        return Counter.builder("tracker.poll.rounds")
                .description("Total poll rounds completed")
                .register(registry);
    }

    @Bean
    public Counter notificationsDispatchedCounter(MeterRegistry registry) {
        return Counter.builder("tracker.notifications.dispatched")
                .description("Total notifications handed to the transport")
                .register(registry);
    }

    @Bean
    public Counter notificationsFailedCounter(MeterRegistry registry) {
        return Counter.builder("tracker.notifications.failed")
                .description("Total notifications the transport rejected")
                .register(registry);
    }

    @Bean
    public Counter catalogSyncsCounter(MeterRegistry registry) {
        return Counter.builder("tracker.catalog.syncs")
                .description("Total catalog syncs that applied a fresh catalog")
                .register(registry);
    }

    @Bean
    public Gauge catalogEntriesGauge(MeterRegistry registry, CatalogStore catalogStore) {
        return Gauge.builder("tracker.catalog.entries", catalogStore::size)
                .description("Names in the current catalog")
                .register(registry);
    }

    @Bean
    public Gauge monitoredItemsGauge(MeterRegistry registry, SubscriptionStore subscriptionStore) {
        try {
            subscriptionStore.refreshMonitoredCount();
        } catch (StorageException e) {
            log.warn("Could not read subscriptions at startup, gauge starts at 0", e);
        }
        return Gauge.builder("tracker.subscriptions.items", subscriptionStore::monitoredCount)
                .description("Items with at least one subscriber")
                .register(registry);
    }
}
