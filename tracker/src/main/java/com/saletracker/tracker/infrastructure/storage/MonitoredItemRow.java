package com.saletracker.tracker.infrastructure.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.util.List;

/**
 * On-disk shape of one {@code monitor_list.json} entry. Price fields are flat siblings and
 * {@code null} until the first poll; {@code currency} and {@code is_free} may be absent in older
 * files.
 */
@JsonPropertyOrder({
    "name",
    "appid",
    "region",
    "last_price",
    "original_price",
    "discount",
    "currency",
    "is_free",
    "subscribers"
})
record MonitoredItemRow(
        String name,
        String appid,
        String region,
        @JsonProperty("last_price") BigDecimal lastPrice,
        @JsonProperty("original_price") BigDecimal originalPrice,
        Integer discount,
        String currency,
        @JsonProperty("is_free") Boolean isFree,
        List<String> subscribers) {}
