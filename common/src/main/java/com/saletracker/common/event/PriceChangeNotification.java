package com.saletracker.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.Builder;

@Builder(toBuilder = true)
public record PriceChangeNotification(
        @JsonProperty("app_id") long appId,
        @JsonProperty("item_name") String itemName,
        @JsonProperty("change_type") PriceChangeType changeType,
        @JsonProperty("previous_price") BigDecimal previousPrice,
        @JsonProperty("current_price") BigDecimal currentPrice,
        @JsonProperty("original_price") BigDecimal originalPrice,
        @JsonProperty("price_delta") BigDecimal priceDelta,
        @JsonProperty("discount_percent") int discountPercent,
        String currency,
        @JsonProperty("purchase_url") String purchaseUrl) {}
