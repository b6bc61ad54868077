package com.pourrice.chat.domain.protocol;

import java.util.Objects;

/**
 * Decoded server-to-client event.
 *
 * <p>The payload type is determined by the event name: {@code RegistrationAck}, {@code JoinAck},
 * {@code ChatMessage}, {@code HistorySnapshot}, {@code TypingIndicator}, {@code PresenceEvent},
 * {@code RoomMembershipEvent} or {@code PrivateMessage}.</p>
 *
 * @param name event name
 * @param payload decoded payload
 * @since 0.1.0
 */
public record InboundEvent(EventName name, Object payload) {

  public InboundEvent {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(payload, "payload");
  }

  /**
   * Casts the payload to the expected type.
   *
   * @param type expected payload type
   * @param <T> payload type
   * @return typed payload
   * @throws IllegalStateException if the payload has another type
   */
  public <T> T payloadAs(Class<T> type) {
    if (!type.isInstance(payload)) {
      throw new IllegalStateException(
          "event " + name.wireName() + " carries " + payload.getClass().getSimpleName() + ", not " + type.getSimpleName());
    }
    return type.cast(payload);
  }
}
