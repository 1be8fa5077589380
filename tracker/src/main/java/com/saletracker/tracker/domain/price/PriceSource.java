package com.saletracker.tracker.domain.price;

import java.util.Optional;

public interface PriceSource {

    /**
     * Current price of {@code appId} in {@code region}. Empty when the item has no price there,
     * the store reports failure, or the request itself fails; never throws.
     */
    Optional<PriceSnapshot> fetchPrice(long appId, String region);
}
