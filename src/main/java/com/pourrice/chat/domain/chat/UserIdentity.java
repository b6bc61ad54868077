package com.pourrice.chat.domain.chat;

import java.util.Objects;

/**
 * Local user identity presented to the chat server.
 *
 * @param userId stable user identifier; never blank
 * @param displayName preferred display name; may be {@code null}
 * @param email account email used as a display fallback; may be {@code null}
 * @since 0.1.0
 */
public record UserIdentity(String userId, String displayName, String email) {
  private static final String ANONYMOUS = "Anonymous";

  public UserIdentity {
    Objects.requireNonNull(userId, "userId");
    if (userId.isBlank()) {
      throw new IllegalArgumentException("userId must not be blank");
    }
  }

  /**
   * Returns the name shown to other participants: display name, then email, then {@code Anonymous}.
   *
   * @return non-blank display name
   */
  public String effectiveDisplayName() {
    if (displayName != null && !displayName.isBlank()) {
      return displayName;
    }
    if (email != null && !email.isBlank()) {
      return email;
    }
    return ANONYMOUS;
  }
}
