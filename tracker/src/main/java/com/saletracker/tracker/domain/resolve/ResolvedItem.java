package com.saletracker.tracker.domain.resolve;

public record ResolvedItem(long appId, String name, int score) {
}
