package com.pourrice.chat.domain.protocol;

import com.pourrice.chat.domain.chat.ChatMessage;
import com.pourrice.chat.domain.chat.MessageKind;
import com.pourrice.chat.domain.chat.RoomId;
import java.util.Objects;

/**
 * Inbound {@code private-message} delivered directly to the local user.
 *
 * @param fromUserId sender
 * @param fromDisplayName sender display name
 * @param message text body
 * @param timestamp server timestamp as received
 * @param messageId server-assigned id
 * @since 0.1.0
 */
public record PrivateMessage(
    String fromUserId, String fromDisplayName, String message, String timestamp, String messageId) {

  public PrivateMessage {
    Objects.requireNonNull(fromUserId, "fromUserId");
    Objects.requireNonNull(messageId, "messageId");
    fromDisplayName = Objects.requireNonNullElse(fromDisplayName, "");
    message = Objects.requireNonNullElse(message, "");
    timestamp = Objects.requireNonNullElse(timestamp, "");
  }

  /**
   * Maps the private message onto the sender's {@code private-} room.
   *
   * @return chat message in room {@code private-<fromUserId>}
   */
  public ChatMessage toChatMessage() {
    return new ChatMessage(
        messageId,
        RoomId.forPrivatePeer(fromUserId),
        fromUserId,
        fromDisplayName,
        message,
        null,
        timestamp,
        MessageKind.TEXT);
  }
}
