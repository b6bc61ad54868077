package com.pourrice.chat.domain.protocol;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Names of the events exchanged over the chat connection.
 * <p><strong>Why:</strong> Keeps the wire vocabulary in one place so codec and components agree on spelling.</p>
 *
 * @since 0.1.0
 */
public enum EventName {
  REGISTER("register"),
  JOIN_ROOM("join-room"),
  LEAVE_ROOM("leave-room"),
  SEND_MESSAGE("send-message"),
  TYPING("typing"),
  /** Used in both directions. */
  PRIVATE_MESSAGE("private-message"),
  REGISTERED("registered"),
  JOINED_ROOM("joined-room"),
  NEW_MESSAGE("new-message"),
  MESSAGE_HISTORY("message-history"),
  USER_TYPING("user-typing"),
  USER_ONLINE("user-online"),
  USER_OFFLINE("user-offline"),
  USER_JOINED_ROOM("user-joined-room"),
  USER_LEFT_ROOM("user-left-room");

  private static final Map<String, EventName> BY_WIRE = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(EventName::wireName, Function.identity()));

  private final String wireName;

  EventName(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the event name as written on the wire.
   *
   * @return wire name, e.g. {@code join-room}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name.
   *
   * @param wireName raw event name; may be {@code null}
   * @return matching event, or empty for unknown names
   */
  public static Optional<EventName> fromWire(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_WIRE.get(wireName));
  }
}
