package com.saletracker.tracker.domain.notification;

import com.saletracker.common.event.NotificationEvent;

/**
 * Outbound transport for price change notifications.
 */
public interface NotificationSender {

    void send(NotificationEvent event);
}
