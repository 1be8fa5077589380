package com.saletracker.tracker.domain.subscription;

public enum UnsubscribeOutcome {
    REMOVED,
    NOT_SUBSCRIBED,
    NOT_MONITORED
}
