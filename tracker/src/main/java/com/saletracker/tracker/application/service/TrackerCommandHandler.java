package com.saletracker.tracker.application.service;

import com.saletracker.common.address.SubscriberAddress;
import com.saletracker.tracker.application.config.TrackerProperties;
import com.saletracker.tracker.application.job.PricePollJob;
import com.saletracker.tracker.domain.catalog.CatalogStore;
import com.saletracker.tracker.domain.resolve.FuzzyResolver;
import com.saletracker.tracker.domain.resolve.ResolvedItem;
import com.saletracker.tracker.domain.subscription.MonitoredItem;
import com.saletracker.tracker.domain.subscription.SubscribeOutcome;
import com.saletracker.tracker.domain.subscription.SubscriptionStore;
import com.saletracker.tracker.domain.subscription.UnsubscribeOutcome;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TrackerCommandHandler {

    private final CatalogStore catalogStore;
    private final FuzzyResolver fuzzyResolver;
    private final SubscriptionStore subscriptionStore;
    private final PricePollJob pricePollJob;
    private final TrackerProperties properties;

    /**
     * Subscribe {@code subscriber} to the item named by {@code query}, an item identifier or a
     * free-text name. A new subscription starts a background round so the baseline price is
     * recorded without waiting for the next scheduled tick.
     */
    public CommandReply subscribe(String query, String subscriber, String region) {
        if (isBlank(query) || isBlank(subscriber)) {
            return CommandReply.of(CommandOutcome.INVALID_INPUT, "Provide a game name or app id, e.g. Cyberpunk 2077");
        }
        if (!catalogStore.awaitInitialized(properties.catalog().readyTimeout()) || catalogStore.isEmpty()) {
            return CommandReply.of(
                    CommandOutcome.CATALOG_UNAVAILABLE, "The game list is not loaded yet or failed to load, try again later");
        }

        var trimmed = query.trim();
        var resolved = isNumeric(trimmed) ? lookupById(Long.parseLong(trimmed)) : fuzzyResolver.resolve(trimmed);
        if (resolved.isEmpty()) {
            return CommandReply.of(
                    CommandOutcome.NOT_FOUND,
                    isNumeric(trimmed)
                            ? "No game with app id " + trimmed
                            : "No game matches '" + trimmed + "', check the spelling or use the English name");
        }

        var item = resolved.get();
        var effectiveRegion = isBlank(region)
                ? properties.price().defaultRegion()
                : region.trim().toLowerCase(Locale.ROOT);
        var outcome = subscriptionStore.subscribe(item.appId(), item.name(), effectiveRegion, subscriber);
        var current = subscriptionStore.find(item.appId()).map(List::of).orElseGet(List::of);

        if (outcome == SubscribeOutcome.ALREADY_SUBSCRIBED) {
            return CommandReply.of(
                    CommandOutcome.ALREADY_SUBSCRIBED, "Already subscribed to " + item.name() + " here", current);
        }
        pricePollJob.runRoundAsync("subscribe");
        return CommandReply.of(CommandOutcome.SUBSCRIBED, subscribedMessage(item, subscriber), current);
    }

    /**
     * Remove {@code subscriber} from an item. Free text is matched only against the caller's own
     * subscriptions, so a typo cannot reach an unrelated catalog item.
     */
    public CommandReply unsubscribe(String query, String subscriber) {
        if (isBlank(query) || isBlank(subscriber)) {
            return CommandReply.of(CommandOutcome.INVALID_INPUT, "Provide a game name or app id, e.g. Cyberpunk 2077");
        }

        var trimmed = query.trim();
        Optional<ResolvedItem> resolved;
        if (isNumeric(trimmed)) {
            var appId = Long.parseLong(trimmed);
            var name = subscriptionStore.find(appId)
                    .map(MonitoredItem::name)
                    .or(() -> catalogStore.nameOf(appId))
                    .orElse(trimmed);
            resolved = Optional.of(new ResolvedItem(appId, name, 100));
        } else {
            var own = new LinkedHashMap<String, Long>();
            subscriptionStore.listByAddress(subscriber).forEach(item -> own.putIfAbsent(item.name(), item.appId()));
            resolved = fuzzyResolver.resolve(trimmed, own);
        }
        if (resolved.isEmpty()) {
            return CommandReply.of(CommandOutcome.NOT_FOUND, "'" + trimmed + "' is not in your subscriptions");
        }

        var item = resolved.get();
        var outcome = subscriptionStore.unsubscribe(item.appId(), subscriber);
        if (outcome == UnsubscribeOutcome.REMOVED) {
            return CommandReply.of(CommandOutcome.UNSUBSCRIBED, "Unsubscribed from " + item.name());
        }
        return CommandReply.of(CommandOutcome.NOT_SUBSCRIBED, "You are not subscribed to " + item.name());
    }

    public CommandReply listSubscriptions(String subscriber) {
        if (isBlank(subscriber)) {
            return CommandReply.of(CommandOutcome.INVALID_INPUT, "Subscriber address is required");
        }
        var items = subscriptionStore.listByAddress(subscriber);
        var message = items.isEmpty() ? "No subscriptions yet" : "Subscribed games: " + items.size();
        return CommandReply.of(CommandOutcome.LISTED, message, items);
    }

    public CommandReply listAll() {
        var items = subscriptionStore.listAll();
        return CommandReply.of(CommandOutcome.LISTED, "Monitored games: " + items.size(), items);
    }

    public CommandReply forcePoll() {
        pricePollJob.runRoundAsync("manual");
        return CommandReply.of(CommandOutcome.POLL_STARTED, "Price check started");
    }

    private Optional<ResolvedItem> lookupById(long appId) {
        return catalogStore.nameOf(appId).map(name -> new ResolvedItem(appId, name, 100));
    }

    private static String subscribedMessage(ResolvedItem item, String subscriber) {
        if (SubscriberAddress.parse(subscriber).isGroup()) {
            return "Subscribed this group to " + item.name() + ", price changes will be announced here";
        }
        return "Subscribed to " + item.name() + " (app id " + item.appId() + "). "
                + "If this is not the game you meant, unsubscribe it";
    }

    private static boolean isNumeric(String value) {
        return !value.isEmpty() && value.length() <= 18 && value.chars().allMatch(Character::isDigit);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
