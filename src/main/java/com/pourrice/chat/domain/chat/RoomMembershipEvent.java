package com.pourrice.chat.domain.chat;

import java.util.Objects;

/**
 * Another participant entering or leaving a room.
 *
 * @param roomId affected room
 * @param userId participant
 * @param joined {@code true} for {@code user-joined-room}, {@code false} for {@code user-left-room}
 * @param timestamp server timestamp as received
 * @since 0.1.0
 */
public record RoomMembershipEvent(RoomId roomId, String userId, boolean joined, String timestamp) {

  public RoomMembershipEvent {
    Objects.requireNonNull(roomId, "roomId");
    Objects.requireNonNull(userId, "userId");
    timestamp = Objects.requireNonNullElse(timestamp, "");
  }
}
