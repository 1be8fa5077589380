package com.saletracker.tracker.domain.subscription;

public enum SubscribeOutcome {
    NEWLY_SUBSCRIBED,
    ALREADY_SUBSCRIBED
}
