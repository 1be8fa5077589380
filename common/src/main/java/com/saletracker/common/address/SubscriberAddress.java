package com.saletracker.common.address;

import java.util.List;
import java.util.Optional;

/**
 * Parsed view of a subscriber address such as {@code aiocqhttp:GroupMessage:10001_20002}.
 *
 * <p>Recognized shapes:
 * <ul>
 *   <li>{@code platform:FriendMessage:userId} - direct channel</li>
 *   <li>{@code platform:GroupMessage:userId_groupId} - group channel with session isolation</li>
 *   <li>{@code platform:GroupMessage:groupId} - group channel without a known sender</li>
 * </ul>
 * Anything else parses to {@link ChannelKind#UNKNOWN}. Equality follows the raw string.
 */
public record SubscriberAddress(
        String raw,
        String platform,
        ChannelKind kind,
        String userId,
        String groupId
) {

    static final String DIRECT_MESSAGE_TYPE = "FriendMessage";
    static final String GROUP_MESSAGE_TYPE = "GroupMessage";

    public static SubscriberAddress parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return unknown(raw, null);
        }
        var parts = raw.split(":", 3);
        if (parts.length < 3 || parts[2].isEmpty()) {
            return unknown(raw, parts[0]);
        }
        var platform = parts[0];
        var identifiers = parts[2];

        return switch (parts[1]) {
            case DIRECT_MESSAGE_TYPE -> new SubscriberAddress(raw, platform, ChannelKind.DIRECT, identifiers, null);
            case GROUP_MESSAGE_TYPE -> group(raw, platform, identifiers);
            default -> unknown(raw, platform);
        };
    }

    private static SubscriberAddress group(String raw, String platform, String identifiers) {
        var separator = identifiers.indexOf('_');
        if (separator < 0) {
            return new SubscriberAddress(raw, platform, ChannelKind.GROUP, null, identifiers);
        }
        var user = identifiers.substring(0, separator);
        var group = identifiers.substring(separator + 1);
        return new SubscriberAddress(
                raw, platform, ChannelKind.GROUP, user.isEmpty() ? null : user, group.isEmpty() ? null : group);
    }

    private static SubscriberAddress unknown(String raw, String platform) {
        return new SubscriberAddress(raw, platform, ChannelKind.UNKNOWN, null, null);
    }

    public boolean isDirect() {
        return kind == ChannelKind.DIRECT;
    }

    public boolean isGroup() {
        return kind == ChannelKind.GROUP;
    }

    public Optional<String> user() {
        return Optional.ofNullable(userId);
    }

    public Optional<String> group() {
        return Optional.ofNullable(groupId);
    }

    /** Users to mention when a group message is delivered; direct messages never mention anyone. */
    public List<String> mentionTargets() {
        if (kind == ChannelKind.GROUP && userId != null) {
            return List.of(userId);
        }
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubscriberAddress other)) return false;
        return raw == null ? other.raw == null : raw.equals(other.raw);
    }

    @Override
    public int hashCode() {
        return raw == null ? 0 : raw.hashCode();
    }

    @Override
    public String toString() {
        return raw;
    }
}
