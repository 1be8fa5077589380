package com.saletracker.tracker.infrastructure.storage;

import com.saletracker.tracker.domain.price.PriceSnapshot;
import com.saletracker.tracker.domain.subscription.MonitoredItem;
import java.util.List;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class MonitoredItemRowMapper {

    static MonitoredItemRow toRow(MonitoredItem item) {
        var price = item.lastPrice();
        return new MonitoredItemRow(
                item.name(),
                String.valueOf(item.appId()),
                item.region(),
                price == null ? null : price.currentPrice(),
                price == null ? null : price.originalPrice(),
                price == null ? null : price.discountPercent(),
                price == null ? null : price.currency(),
                price == null ? null : price.free(),
                item.subscribers());
    }

    static MonitoredItem toDomain(long appId, MonitoredItemRow row, String defaultRegion) {
        return MonitoredItem.builder()
                .appId(appId)
                .name(row.name() == null ? String.valueOf(appId) : row.name())
                .region(row.region() == null || row.region().isBlank() ? defaultRegion : row.region())
                .lastPrice(toSnapshot(row))
                .subscribers(row.subscribers() == null ? List.of() : row.subscribers())
                .build();
    }

    private static PriceSnapshot toSnapshot(MonitoredItemRow row) {
        if (row.lastPrice() == null) {
            return null;
        }
        return PriceSnapshot.builder()
                .currentPrice(row.lastPrice())
                .originalPrice(row.originalPrice() == null ? row.lastPrice() : row.originalPrice())
                .discountPercent(row.discount() == null ? 0 : row.discount())
                .free(Boolean.TRUE.equals(row.isFree()))
                .currency(row.currency() == null ? "" : row.currency())
                .build();
    }
}
