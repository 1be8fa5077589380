package com.saletracker.tracker.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "tracker")
public record TrackerProperties(
        @NotNull @Valid Catalog catalog,
        @NotNull @Valid Price price,
        @NotNull @Valid Poll poll,
        @NotNull @Valid Storage storage,
        @NotNull @Valid Notification notification,
        @NotNull @Valid Http http) {

    /**
     * @param apiKey        store web API key, never logged
     * @param pageSize      {@code max_results} per catalog page
     * @param readyTimeout  how long a command waits for the first catalog sync
     */
    public record Catalog(
            @NotBlank String baseUrl,
            String apiKey,
            @Positive @Max(50000) int pageSize,
            @NotNull Duration pageDelay,
            @NotNull Duration refreshInterval,
            @NotNull Duration readyTimeout,
            boolean syncOnStartup,
            boolean includeGames,
            boolean includeDlc,
            boolean includeSoftware,
            boolean includeVideos,
            boolean includeHardware) {}

    public record Price(@NotBlank String baseUrl, @NotBlank String defaultRegion, @NotBlank String locale) {}

    public record Poll(@NotNull Duration interval) {}

    public record Storage(@NotBlank String dataDir, @NotBlank String catalogFile, @NotBlank String subscriptionsFile) {}

    public record Notification(@NotNull Duration pacing) {}

    public record Http(@NotNull Duration connectTimeout, @NotNull Duration readTimeout) {}
}
