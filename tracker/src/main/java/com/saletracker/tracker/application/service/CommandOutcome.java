package com.saletracker.tracker.application.service;

public enum CommandOutcome {
    SUBSCRIBED,
    ALREADY_SUBSCRIBED,
    UNSUBSCRIBED,
    NOT_SUBSCRIBED,
    NOT_FOUND,
    CATALOG_UNAVAILABLE,
    LISTED,
    POLL_STARTED,
    INVALID_INPUT
}
