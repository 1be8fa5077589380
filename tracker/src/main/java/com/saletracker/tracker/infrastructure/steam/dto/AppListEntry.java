package com.saletracker.tracker.infrastructure.steam.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AppListEntry(@JsonProperty("appid") Long appId, String name) {}
