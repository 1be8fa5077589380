package com.saletracker.tracker.domain.poll;

import com.saletracker.common.event.PriceChangeNotification;
import com.saletracker.common.event.PriceChangeType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders a price change into display segments: headline, price details, store link.
 */
@Component
public class PriceChangeMessageFormatter {

    public List<String> render(PriceChangeNotification notification) {
        return List.of(headline(notification), details(notification), link(notification));
    }

    private String headline(PriceChangeNotification n) {
        return switch (n.changeType()) {
            case BECAME_FREE -> n.itemName() + " is now free!\n";
            case INCREASE -> n.itemName() + " went up by " + amount(n.priceDelta().abs(), n.currency()) + "\n";
            case DECREASE -> n.itemName() + " dropped by " + amount(n.priceDelta().abs(), n.currency()) + "\n";
        };
    }

    private String details(PriceChangeNotification n) {
        if (n.changeType() == PriceChangeType.BECAME_FREE) {
            return "Previous price: " + amount(n.previousPrice(), n.currency()) + "\n";
        }
        return "Current price: " + amount(n.currentPrice(), n.currency())
                + " (was " + amount(n.previousPrice(), n.currency()) + ")"
                + ", original price: " + amount(n.originalPrice(), n.currency())
                + ", discount: " + n.discountPercent() + "%\n";
    }

    private String link(PriceChangeNotification n) {
        return "Store page: " + n.purchaseUrl();
    }

    static String amount(BigDecimal value, String currency) {
        var formatted = value == null ? "?" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
        return currency == null || currency.isBlank() ? formatted : formatted + " " + currency;
    }
}
