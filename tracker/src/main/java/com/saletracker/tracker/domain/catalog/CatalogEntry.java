package com.saletracker.tracker.domain.catalog;

public record CatalogEntry(String name, long appId) {
}
