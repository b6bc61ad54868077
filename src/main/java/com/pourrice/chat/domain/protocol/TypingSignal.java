package com.pourrice.chat.domain.protocol;

import com.pourrice.chat.domain.chat.RoomId;
import java.util.Objects;

/**
 * Outbound {@code typing} payload.
 *
 * @param roomId room being typed in
 * @param userId local user id
 * @param displayName local display name
 * @param typing {@code isTyping} flag
 * @since 0.1.0
 */
public record TypingSignal(RoomId roomId, String userId, String displayName, boolean typing) implements OutboundEvent {

  public TypingSignal {
    Objects.requireNonNull(roomId, "roomId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(displayName, "displayName");
  }

  @Override
  public EventName name() {
    return EventName.TYPING;
  }
}
