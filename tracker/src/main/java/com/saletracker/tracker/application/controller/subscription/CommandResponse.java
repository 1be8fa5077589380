package com.saletracker.tracker.application.controller.subscription;

import com.saletracker.tracker.application.service.CommandOutcome;
import java.util.List;

public record CommandResponse(CommandOutcome outcome, String message, List<SubscriptionResponse> items) {}
