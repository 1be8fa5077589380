package com.saletracker.tracker.infrastructure.steam.dto;

/** One entry of the {@code appdetails} response, keyed by the requested identifier. */
public record AppDetailsEnvelope(Boolean success, AppDetails data) {}
