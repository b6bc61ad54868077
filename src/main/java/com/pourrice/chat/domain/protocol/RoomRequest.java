package com.pourrice.chat.domain.protocol;

import com.pourrice.chat.domain.chat.RoomId;
import java.util.Objects;

/**
 * {@code join-room} or {@code leave-room} payload.
 *
 * @param name {@link EventName#JOIN_ROOM} or {@link EventName#LEAVE_ROOM}
 * @param roomId target room
 * @param userId local user id
 * @param authToken short-lived bearer token
 * @since 0.1.0
 */
public record RoomRequest(EventName name, RoomId roomId, String userId, String authToken) implements OutboundEvent {

  public RoomRequest {
    Objects.requireNonNull(name, "name");
    if (name != EventName.JOIN_ROOM && name != EventName.LEAVE_ROOM) {
      throw new IllegalArgumentException("room request must be join-room or leave-room, got " + name);
    }
    Objects.requireNonNull(roomId, "roomId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(authToken, "authToken");
  }

  public static RoomRequest join(RoomId roomId, String userId, String authToken) {
    return new RoomRequest(EventName.JOIN_ROOM, roomId, userId, authToken);
  }

  public static RoomRequest leave(RoomId roomId, String userId, String authToken) {
    return new RoomRequest(EventName.LEAVE_ROOM, roomId, userId, authToken);
  }

  @Override
  public String toString() {
    return "RoomRequest[name=" + name + ", roomId=" + roomId + ", userId=" + userId + ", authToken=[REDACTED]]";
  }
}
