package com.saletracker.tracker.application.controller.subscription;

import java.math.BigDecimal;

public record PriceResponse(
        BigDecimal currentPrice,
        BigDecimal originalPrice,
        Integer discountPercent,
        Boolean free,
        String currency) {}
