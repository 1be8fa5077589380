package com.saletracker.tracker.infrastructure.steam;

import com.saletracker.common.json.JacksonConfig;
import com.saletracker.tracker.application.config.TrackerProperties;
import com.saletracker.tracker.domain.price.PriceSnapshot;
import com.saletracker.tracker.domain.price.PriceSource;
import com.saletracker.tracker.infrastructure.steam.dto.AppDetailsEnvelope;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Store {@code appdetails} adapter. Every failure mode ends as "no price available".
 */
@Slf4j
@Component
public class SteamStorePriceClient implements PriceSource {

    private static final TypeReference<Map<String, AppDetailsEnvelope>> RESPONSE_TYPE = new TypeReference<>() {};

    private final RestClient restClient;
    private final String locale;
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    public SteamStorePriceClient(@Qualifier("storeRestClient") RestClient restClient, TrackerProperties properties) {
        this.restClient = restClient;
        this.locale = properties.price().locale();
    }

    @Override
    public Optional<PriceSnapshot> fetchPrice(long appId, String region) {
        try {
            var body = restClient.get()
                    .uri(uri -> uri.path("/api/appdetails")
                            .queryParam("appids", appId)
                            .queryParam("cc", region)
                            .queryParam("l", locale)
                            .build())
                    .retrieve()
                    .body(String.class);
            if (body == null || body.isBlank()) {
                log.warn("Empty price response for appid={}, region={}", appId, region);
                return Optional.empty();
            }
            Map<String, AppDetailsEnvelope> response = objectMapper.readValue(body, RESPONSE_TYPE);
            return toSnapshot(appId, region, response == null ? null : response.get(String.valueOf(appId)));
        } catch (RestClientException e) {
            log.warn("Price request failed for appid={}, region={}: {}", appId, region, e.getMessage());
            return Optional.empty();
        } catch (JacksonException e) {
            log.warn("Malformed price response for appid={}, region={}: {}", appId, region, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Optional<PriceSnapshot> toSnapshot(long appId, String region, AppDetailsEnvelope envelope) {
        if (envelope == null || !Boolean.TRUE.equals(envelope.success()) || envelope.data() == null) {
            log.warn("Store reported no details for appid={}, region={}", appId, region);
            return Optional.empty();
        }
        var details = envelope.data();
        if (Boolean.TRUE.equals(details.free())) {
            return Optional.of(PriceSnapshot.freeToPlay());
        }
        var overview = details.priceOverview();
        if (overview == null) {
            log.info("{} ({}) has no price in region {}, unreleased or not sold there", details.name(), appId, region);
            return Optional.empty();
        }
        if (overview.finalPrice() == null) {
            log.warn("Price overview for appid={} has no final price", appId);
            return Optional.empty();
        }
        var current = toMajorUnits(overview.finalPrice());
        var original = overview.initial() == null ? current : toMajorUnits(overview.initial());
        return Optional.of(PriceSnapshot.builder()
                .currentPrice(current)
                .originalPrice(original)
                .discountPercent(overview.discountPercent() == null ? 0 : overview.discountPercent())
                .free(false)
                .currency(overview.currency() == null ? "" : overview.currency())
                .build());
    }

    private static BigDecimal toMajorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, 2);
    }
}
