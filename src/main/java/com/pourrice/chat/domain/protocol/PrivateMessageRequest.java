package com.pourrice.chat.domain.protocol;

import java.util.Objects;

/**
 * Outbound {@code private-message} payload addressed to a single user.
 *
 * @param toUserId recipient
 * @param fromUserId local user id
 * @param fromDisplayName local display name
 * @param message text body
 * @since 0.1.0
 */
public record PrivateMessageRequest(String toUserId, String fromUserId, String fromDisplayName, String message)
    implements OutboundEvent {

  public PrivateMessageRequest {
    Objects.requireNonNull(toUserId, "toUserId");
    Objects.requireNonNull(fromUserId, "fromUserId");
    Objects.requireNonNull(fromDisplayName, "fromDisplayName");
    Objects.requireNonNull(message, "message");
  }

  @Override
  public EventName name() {
    return EventName.PRIVATE_MESSAGE;
  }
}
