package com.saletracker.tracker.infrastructure.notification;

import com.saletracker.common.address.SubscriberAddress;
import com.saletracker.common.event.NotificationEvent;
import com.saletracker.tracker.domain.notification.NotificationSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default transport: writes each notification to the log. A chat transport replaces it with a
 * {@code @Primary} {@link NotificationSender} bean.
 */
@Slf4j
@Component
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public void send(NotificationEvent event) {
        var address = SubscriberAddress.parse(event.subscriberAddress());
        if (address.isGroup() && event.mentionTargets().isEmpty()) {
            log.warn("Group notification for {} has no mention target", address.raw());
        }
        log.info("notification.sent: to={}, mentions={}, text={}",
                event.subscriberAddress(), event.mentionTargets(), event.text());
    }
}
