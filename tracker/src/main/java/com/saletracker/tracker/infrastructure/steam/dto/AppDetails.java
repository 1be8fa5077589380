package com.saletracker.tracker.infrastructure.steam.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AppDetails(
        String name,
        @JsonProperty("is_free") Boolean free,
        @JsonProperty("price_overview") PriceOverview priceOverview) {}
