package com.saletracker.tracker.infrastructure.steam;

import com.saletracker.common.json.JacksonConfig;
import com.saletracker.tracker.application.config.TrackerProperties;
import com.saletracker.tracker.domain.catalog.CatalogEntry;
import com.saletracker.tracker.domain.catalog.CatalogPage;
import com.saletracker.tracker.domain.catalog.CatalogSource;
import com.saletracker.tracker.domain.exceptions.CatalogSyncException;
import com.saletracker.tracker.infrastructure.steam.dto.AppListEnvelope;
import com.saletracker.tracker.infrastructure.steam.dto.AppListEntry;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * {@code IStoreService/GetAppList} adapter. Failures are raised as {@link CatalogSyncException}
 * with the API key redacted from every message.
 */
@Slf4j
@Component
public class SteamAppListClient implements CatalogSource {

    static final String APP_LIST_PATH = "/IStoreService/GetAppList/v1/";
    private static final String REDACTED = "***";

    private final RestClient restClient;
    private final TrackerProperties.Catalog properties;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    public SteamAppListClient(@Qualifier("catalogRestClient") RestClient restClient, TrackerProperties properties) {
        this.restClient = restClient;
        this.properties = properties.catalog();
    }

    @Override
    public CatalogPage fetchPage(long cursor) {
        String body;
        try {
            body = restClient.get()
                    .uri(uri -> uri.path(APP_LIST_PATH)
                            .queryParam("key", properties.apiKey() == null ? "" : properties.apiKey())
                            .queryParam("max_results", properties.pageSize())
                            .queryParam("last_appid", cursor)
                            .queryParam("include_games", properties.includeGames())
                            .queryParam("include_dlc", properties.includeDlc())
                            .queryParam("include_software", properties.includeSoftware())
                            .queryParam("include_videos", properties.includeVideos())
                            .queryParam("include_hardware", properties.includeHardware())
                            .build())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw CatalogSyncException.transport(cursor, redact(e.getMessage()));
        }

        if (body == null || body.isBlank()) {
            throw CatalogSyncException.malformedResponse(cursor, "empty body");
        }
        AppListEnvelope envelope;
        try {
            envelope = objectMapper.readValue(body, AppListEnvelope.class);
        } catch (JacksonException e) {
            throw CatalogSyncException.malformedResponse(cursor, e);
        }
        if (envelope == null || envelope.response() == null) {
            throw CatalogSyncException.malformedResponse(cursor, "missing 'response' object");
        }

        var response = envelope.response();
        var apps = response.apps() == null ? List.<AppListEntry>of() : response.apps();
        var entries = apps.stream()
                .filter(Objects::nonNull)
                .filter(app -> app.appId() != null)
                .map(app -> new CatalogEntry(app.name(), app.appId()))
                .toList();
        log.debug("Catalog page at cursor {}: {} apps, more={}", cursor, entries.size(), response.haveMoreResults());
        return new CatalogPage(entries, Boolean.TRUE.equals(response.haveMoreResults()), response.lastAppId());
    }

    private String redact(String message) {
        if (message == null) {
            return "no detail";
        }
        var key = properties.apiKey();
        return key == null || key.isBlank() ? message : message.replace(key, REDACTED);
    }
}
