package com.pourrice.chat.domain.chat;

import java.util.Objects;

/**
 * Online/offline transition of a user as broadcast by the server.
 *
 * @param userId user whose presence changed
 * @param displayName display name reported with the event
 * @param online {@code true} for {@code user-online}, {@code false} for {@code user-offline}
 * @param timestamp server timestamp (or last-seen time for offline events) as received
 * @since 0.1.0
 */
public record PresenceEvent(String userId, String displayName, boolean online, String timestamp) {

  public PresenceEvent {
    Objects.requireNonNull(userId, "userId");
    displayName = Objects.requireNonNullElse(displayName, "");
    timestamp = Objects.requireNonNullElse(timestamp, "");
  }
}
