package com.pourrice.chat.domain.protocol;

import com.pourrice.chat.domain.chat.RoomId;
import java.util.Objects;

/**
 * {@code send-message} payload. The server echoes accepted messages back as {@code new-message}.
 *
 * @param roomId target room
 * @param userId author id
 * @param displayName author display name
 * @param message text body; may be empty when {@code imageUrl} is set
 * @param imageUrl uploaded image reference or {@code null}
 * @param authToken short-lived bearer token
 * @since 0.1.0
 */
public record SendMessageRequest(
    RoomId roomId, String userId, String displayName, String message, String imageUrl, String authToken)
    implements OutboundEvent {

  public SendMessageRequest {
    Objects.requireNonNull(roomId, "roomId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(displayName, "displayName");
    message = Objects.requireNonNullElse(message, "");
    Objects.requireNonNull(authToken, "authToken");
  }

  @Override
  public EventName name() {
    return EventName.SEND_MESSAGE;
  }

  @Override
  public String toString() {
    return "SendMessageRequest[roomId=" + roomId + ", userId=" + userId + ", chars=" + message.length()
        + ", imageUrl=" + imageUrl + ", authToken=[REDACTED]]";
  }
}
