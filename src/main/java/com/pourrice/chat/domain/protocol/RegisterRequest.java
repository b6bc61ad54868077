package com.pourrice.chat.domain.protocol;

import java.util.Objects;

/**
 * {@code register} payload binding the connection to a user identity.
 *
 * @param userId local user id
 * @param displayName name shown to other participants
 * @param authToken short-lived bearer token
 * @since 0.1.0
 */
public record RegisterRequest(String userId, String displayName, String authToken) implements OutboundEvent {

  public RegisterRequest {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(displayName, "displayName");
    Objects.requireNonNull(authToken, "authToken");
  }

  @Override
  public EventName name() {
    return EventName.REGISTER;
  }

  @Override
  public String toString() {
    return "RegisterRequest[userId=" + userId + ", displayName=" + displayName + ", authToken=[REDACTED]]";
  }
}
