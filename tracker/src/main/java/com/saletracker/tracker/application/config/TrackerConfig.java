package com.saletracker.tracker.application.config;

import com.saletracker.tracker.domain.catalog.CatalogSnapshotRepository;
import com.saletracker.tracker.domain.catalog.CatalogSource;
import com.saletracker.tracker.domain.catalog.CatalogStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerConfig {

    @Bean
    public CatalogStore catalogStore(
            CatalogSource catalogSource, CatalogSnapshotRepository snapshotRepository, TrackerProperties properties) {
        return new CatalogStore(catalogSource, snapshotRepository, properties.catalog().pageDelay());
    }
}
