package com.saletracker.tracker.application.controller;

import com.saletracker.tracker.application.controller.subscription.CommandResponse;
import com.saletracker.tracker.application.controller.subscription.SubscribeRequest;
import com.saletracker.tracker.application.controller.subscription.SubscriptionResponse;
import com.saletracker.tracker.application.controller.subscription.mapper.SubscriptionResponseMapper;
import com.saletracker.tracker.application.service.CommandReply;
import com.saletracker.tracker.application.service.TrackerCommandHandler;
import com.saletracker.tracker.domain.subscription.MonitoredItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class TrackerController {

    private final TrackerCommandHandler commandHandler;
    private final SubscriptionResponseMapper mapper;

    @PostMapping("/subscriptions")
    public ResponseEntity<CommandResponse> subscribe(@Valid @RequestBody SubscribeRequest request) {
        var reply = commandHandler.subscribe(request.query(), request.subscriber(), request.region());
        return respond(reply, mapper::toResponse);
    }

    @DeleteMapping("/subscriptions")
    public ResponseEntity<CommandResponse> unsubscribe(
            @RequestParam @NotBlank String query, @RequestParam @NotBlank String subscriber) {
        return respond(commandHandler.unsubscribe(query, subscriber), mapper::toResponse);
    }

    @GetMapping("/subscriptions")
    public ResponseEntity<CommandResponse> listSubscriptions(@RequestParam @NotBlank String subscriber) {
        return respond(commandHandler.listSubscriptions(subscriber), mapper::toResponse);
    }

    @GetMapping("/subscriptions/all")
    public ResponseEntity<CommandResponse> listAll() {
        return respond(commandHandler.listAll(), mapper::toDetailedResponse);
    }

    @PostMapping("/polls")
    public ResponseEntity<CommandResponse> forcePoll() {
        return respond(commandHandler.forcePoll(), mapper::toResponse);
    }

    private static ResponseEntity<CommandResponse> respond(
            CommandReply reply, Function<MonitoredItem, SubscriptionResponse> itemMapper) {
        var body = new CommandResponse(
                reply.outcome(), reply.message(), reply.items().stream().map(itemMapper).toList());
        return ResponseEntity.status(statusOf(reply)).body(body);
    }

    private static HttpStatus statusOf(CommandReply reply) {
        return switch (reply.outcome()) {
            case SUBSCRIBED -> HttpStatus.CREATED;
            case POLL_STARTED -> HttpStatus.ACCEPTED;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CATALOG_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case ALREADY_SUBSCRIBED, UNSUBSCRIBED, NOT_SUBSCRIBED, LISTED -> HttpStatus.OK;
        };
    }
}
