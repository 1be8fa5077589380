package com.saletracker.tracker.application.controller.subscription;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** {@code lastPrice} is null until the first poll; {@code subscribers} only appears on the admin listing. */
public record SubscriptionResponse(
        Long appId,
        String name,
        String region,
        PriceResponse lastPrice,
        @JsonInclude(JsonInclude.Include.NON_NULL) List<String> subscribers) {}
