package com.pourrice.chat.domain.chat;

import java.util.Objects;

/**
 * Ephemeral typing state of one user in one room. Never persisted.
 *
 * @param roomId room the indicator applies to
 * @param userId typing user
 * @param displayName typing user's display name
 * @param typing whether the user is currently typing
 * @since 0.1.0
 */
public record TypingIndicator(RoomId roomId, String userId, String displayName, boolean typing) {

  public TypingIndicator {
    Objects.requireNonNull(roomId, "roomId");
    Objects.requireNonNull(userId, "userId");
    displayName = Objects.requireNonNullElse(displayName, "");
  }

  /**
   * Returns the same indicator with {@code typing=false}.
   *
   * @return stopped indicator
   */
  public TypingIndicator stopped() {
    return new TypingIndicator(roomId, userId, displayName, false);
  }
}
