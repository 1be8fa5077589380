package com.saletracker.tracker.application.service;

import com.saletracker.tracker.domain.subscription.MonitoredItem;
import java.util.List;

/**
 * Result of a user command: a machine-readable outcome, a user-facing message, and the items the
 * command touched or listed.
 */
public record CommandReply(CommandOutcome outcome, String message, List<MonitoredItem> items) {

    public CommandReply {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static CommandReply of(CommandOutcome outcome, String message) {
        return new CommandReply(outcome, message, List.of());
    }

    public static CommandReply of(CommandOutcome outcome, String message, List<MonitoredItem> items) {
        return new CommandReply(outcome, message, items);
    }
}
