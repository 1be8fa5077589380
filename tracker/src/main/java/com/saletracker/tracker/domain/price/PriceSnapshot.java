package com.saletracker.tracker.domain.price;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Price state observed for one item in one region.
 */
@Builder(toBuilder = true)
public record PriceSnapshot(
        BigDecimal currentPrice,
        BigDecimal originalPrice,
        int discountPercent,
        boolean free,
        String currency
) {

    public static final String FREE_CURRENCY = "FREE";

    public static PriceSnapshot freeToPlay() {
        return new PriceSnapshot(BigDecimal.ZERO, BigDecimal.ZERO, 100, true, FREE_CURRENCY);
    }
}
