package com.saletracker.tracker.infrastructure.steam.dto;

public record AppListEnvelope(AppListResponse response) {}
