package com.saletracker.tracker.infrastructure.steam.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record AppListResponse(
        List<AppListEntry> apps,
        @JsonProperty("have_more_results") Boolean haveMoreResults,
        @JsonProperty("last_appid") Long lastAppId) {}
