package com.saletracker.tracker.domain.poll;

import com.saletracker.tracker.domain.price.PriceSnapshot;
import com.saletracker.tracker.domain.subscription.MonitoredItem;
import java.math.BigDecimal;

/**
 * Outcome of comparing one fetched snapshot with the stored one inside the store's exclusive
 * section.
 *
 * @param item     the item as re-read inside the exclusive section, {@code null} for {@link Kind#ITEM_REMOVED}
 * @param previous stored snapshot before the comparison, {@code null} for a baseline
 */
record PriceObservation(Kind kind, MonitoredItem item, PriceSnapshot previous, PriceSnapshot current) {

    enum Kind {
        BASELINE,
        UNCHANGED,
        CHANGED,
        ITEM_REMOVED
    }

    static PriceObservation removed(PriceSnapshot current) {
        return new PriceObservation(Kind.ITEM_REMOVED, null, null, current);
    }

    static PriceObservation baseline(MonitoredItem item, PriceSnapshot current) {
        return new PriceObservation(Kind.BASELINE, item, null, current);
    }

    static PriceObservation unchanged(MonitoredItem item, PriceSnapshot current) {
        return new PriceObservation(Kind.UNCHANGED, item, item.lastPrice(), current);
    }

    static PriceObservation changed(MonitoredItem item, PriceSnapshot previous, PriceSnapshot current) {
        return new PriceObservation(Kind.CHANGED, item, previous, current);
    }

    BigDecimal delta() {
        return current.currentPrice().subtract(previous.currentPrice());
    }
}
