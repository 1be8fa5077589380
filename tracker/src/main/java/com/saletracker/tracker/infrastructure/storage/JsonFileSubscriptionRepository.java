package com.saletracker.tracker.infrastructure.storage;

import com.saletracker.common.json.JacksonConfig;
import com.saletracker.tracker.application.config.TrackerProperties;
import com.saletracker.tracker.domain.subscription.MonitoredItem;
import com.saletracker.tracker.domain.subscription.SubscriptionRepository;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.type.TypeReference;

/**
 * {@code monitor_list.json}: item identifier (as a string key) to item row, in subscription order.
 */
@Slf4j
@Component
public class JsonFileSubscriptionRepository implements SubscriptionRepository {

    private static final TypeReference<LinkedHashMap<String, MonitoredItemRow>> DOCUMENT_TYPE =
            new TypeReference<>() {};

    private final JsonDocumentFile<LinkedHashMap<String, MonitoredItemRow>> file;
    private final String defaultRegion;

    @Autowired
    public JsonFileSubscriptionRepository(TrackerProperties properties) {
        this(
                Path.of(properties.storage().dataDir()).resolve(properties.storage().subscriptionsFile()),
                properties.price().defaultRegion());
    }

    JsonFileSubscriptionRepository(Path path, String defaultRegion) {
        this.file = new JsonDocumentFile<>(path, JacksonConfig.createObjectMapper(), DOCUMENT_TYPE, "{}");
        this.defaultRegion = defaultRegion;
    }

    @Override
    public Map<Long, MonitoredItem> load() {
        var rows = file.read().orElseGet(LinkedHashMap::new);
        var items = new LinkedHashMap<Long, MonitoredItem>();
        rows.forEach((key, row) -> {
            var appId = parseAppId(key);
            if (appId == null || row == null) {
                log.warn("Skipping unreadable entry '{}' in {}", key, file.path());
                return;
            }
            items.put(appId, MonitoredItemRowMapper.toDomain(appId, row, defaultRegion));
        });
        return items;
    }

    @Override
    public void save(Map<Long, MonitoredItem> items) {
        var rows = new LinkedHashMap<String, MonitoredItemRow>();
        items.forEach((appId, item) -> rows.put(String.valueOf(appId), MonitoredItemRowMapper.toRow(item)));
        file.write(rows);
        log.debug("Persisted {} monitored items to {}", rows.size(), file.path());
    }

    private static Long parseAppId(String key) {
        try {
            return Long.parseLong(key.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
