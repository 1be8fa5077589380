package com.saletracker.tracker.domain.poll;

import static org.assertj.core.api.Assertions.assertThat;

import com.saletracker.common.event.PriceChangeNotification;
import com.saletracker.common.event.PriceChangeType;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class PriceChangeMessageFormatterTest {

    private final PriceChangeMessageFormatter formatter = new PriceChangeMessageFormatter();

    private static PriceChangeNotification.PriceChangeNotificationBuilder notification() {
        return PriceChangeNotification.builder()
                .appId(1091500L)
                .itemName("Cyberpunk 2077")
                .previousPrice(new BigDecimal("59.99"))
                .currentPrice(new BigDecimal("39.99"))
                .originalPrice(new BigDecimal("59.99"))
                .priceDelta(new BigDecimal("-20.00"))
                .discountPercent(33)
                .currency("CNY")
                .purchaseUrl("https://store.steampowered.com/app/1091500");
    }

    @Test
    void shouldRenderDecreaseWithDetailsAndLink() {
        // when
        var segments = formatter.render(notification().changeType(PriceChangeType.DECREASE).build());

        // then
        assertThat(segments).containsExactly(
                "Cyberpunk 2077 dropped by 20.00 CNY\n",
                "Current price: 39.99 CNY (was 59.99 CNY), original price: 59.99 CNY, discount: 33%\n",
                "Store page: https://store.steampowered.com/app/1091500");
    }

    @Test
    void shouldRenderIncreaseWithAbsoluteDelta() {
        // when
        var segments = formatter.render(notification()
                .changeType(PriceChangeType.INCREASE)
                .previousPrice(new BigDecimal("39.99"))
                .currentPrice(new BigDecimal("59.99"))
                .priceDelta(new BigDecimal("20.00"))
                .discountPercent(0)
                .build());

        // then
        assertThat(segments.get(0)).isEqualTo("Cyberpunk 2077 went up by 20.00 CNY\n");
    }

    @Test
    void shouldRenderBecameFree() {
        // when
        var segments = formatter.render(notification()
                .changeType(PriceChangeType.BECAME_FREE)
                .currentPrice(BigDecimal.ZERO)
                .originalPrice(BigDecimal.ZERO)
                .priceDelta(new BigDecimal("-59.99"))
                .discountPercent(100)
                .build());

        // then
        assertThat(segments.get(0)).isEqualTo("Cyberpunk 2077 is now free!\n");
        assertThat(segments.get(1)).isEqualTo("Previous price: 59.99 CNY\n");
    }

    @Test
    void shouldPadAmountsToTwoDecimals() {
        assertThat(PriceChangeMessageFormatter.amount(new BigDecimal("5"), "USD")).isEqualTo("5.00 USD");
        assertThat(PriceChangeMessageFormatter.amount(new BigDecimal("5.5"), "")).isEqualTo("5.50");
    }
}
