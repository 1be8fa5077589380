package com.saletracker.tracker.application.controller.subscription;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record SubscribeRequest(
        @NotBlank @Size(max = 200)
        String query,

        @NotBlank @Size(max = 200)
        String subscriber,

        @Pattern(regexp = "^[A-Za-z]{2}$", message = "Region must be a two-letter country code")
        String region
) {
}
