package com.saletracker.tracker.infrastructure.storage;

import com.saletracker.common.json.JacksonConfig;
import com.saletracker.tracker.application.config.TrackerProperties;
import com.saletracker.tracker.domain.catalog.CatalogSnapshotRepository;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.core.type.TypeReference;

/** {@code game_list.json}: catalog name to identifier. */
@Slf4j
@Component
public class JsonFileCatalogSnapshotRepository implements CatalogSnapshotRepository {

    private static final TypeReference<LinkedHashMap<String, Long>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final JsonDocumentFile<LinkedHashMap<String, Long>> file;

    @Autowired
    public JsonFileCatalogSnapshotRepository(TrackerProperties properties) {
        this(Path.of(properties.storage().dataDir()).resolve(properties.storage().catalogFile()));
    }

    JsonFileCatalogSnapshotRepository(Path path) {
        this.file = new JsonDocumentFile<>(path, JacksonConfig.createObjectMapper(), DOCUMENT_TYPE, "{}");
    }

    @Override
    public Map<String, Long> load() {
        return file.read().map(Collections::unmodifiableMap).orElseGet(Map::of);
    }

    @Override
    public void save(Map<String, Long> snapshot) {
        file.write(new LinkedHashMap<>(snapshot));
        log.info("Catalog snapshot written: {} entries to {}", snapshot.size(), file.path());
    }
}
