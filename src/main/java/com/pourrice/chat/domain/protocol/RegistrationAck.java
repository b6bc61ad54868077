package com.pourrice.chat.domain.protocol;

import java.util.Objects;

/**
 * Inbound {@code registered} acknowledgement.
 *
 * @param success whether the server accepted the registration
 * @param userId user id echoed by the server
 * @param socketId server-side connection id
 * @since 0.1.0
 */
public record RegistrationAck(boolean success, String userId, String socketId) {

  public RegistrationAck {
    userId = Objects.requireNonNullElse(userId, "");
    socketId = Objects.requireNonNullElse(socketId, "");
  }
}
