package com.saletracker.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;

/**
 * One delivery unit handed to the transport: where to send, whom to mention, and the rendered
 * text segments in display order. The transport owns how segments render and how mentions attach.
 */
@Builder(toBuilder = true)
public record NotificationEvent(
        @JsonProperty("subscriber_address") String subscriberAddress,
        @JsonProperty("mention_targets") List<String> mentionTargets,
        PriceChangeNotification payload,
        List<String> segments) {

    public NotificationEvent {
        mentionTargets = mentionTargets == null ? List.of() : List.copyOf(mentionTargets);
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public String text() {
        return String.join("", segments);
    }
}
