package com.saletracker.tracker.infrastructure.steam.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Prices in minor currency units. */
public record PriceOverview(
        String currency,
        Long initial,
        @JsonProperty("final") Long finalPrice,
        @JsonProperty("discount_percent") Integer discountPercent) {}
