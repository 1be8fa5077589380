package com.saletracker.tracker.application.service;

import com.saletracker.common.event.NotificationEvent;
import com.saletracker.tracker.application.config.TrackerProperties;
import com.saletracker.tracker.domain.notification.NotificationSender;
import io.micrometer.core.instrument.Counter;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drains a round's event stream into the transport, one event at a time with a fixed pause
 * between sends. A rejected event is logged and counted; the rest of the round still goes out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final NotificationSender notificationSender;
    private final TrackerProperties properties;
    private final Counter notificationsDispatchedCounter;
    private final Counter notificationsFailedCounter;

    /** @return number of events the transport accepted */
    public int dispatch(Stream<NotificationEvent> events) {
        var delivered = 0;
        var first = true;
        try (events) {
            var iterator = events.iterator();
            while (iterator.hasNext()) {
                var event = iterator.next();
                if (!first && !pace()) {
                    log.warn("Dispatch interrupted, {} notifications delivered so far", delivered);
                    break;
                }
                first = false;
                try {
                    notificationSender.send(event);
                    delivered++;
                    notificationsDispatchedCounter.increment();
                } catch (RuntimeException e) {
                    notificationsFailedCounter.increment();
                    log.error("Failed to deliver notification to {}", event.subscriberAddress(), e);
                }
            }
        }
        return delivered;
    }

    private boolean pace() {
        var pacing = properties.notification().pacing();
        if (pacing.isZero() || pacing.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(pacing.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
