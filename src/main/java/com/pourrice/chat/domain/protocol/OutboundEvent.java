package com.pourrice.chat.domain.protocol;

/**
 * Marker for client-to-server events. Implementations are immutable records encoded by the wire codec.
 *
 * @since 0.1.0
 */
public interface OutboundEvent {
  /**
   * Returns the event name the payload is sent under.
   *
   * @return event name
   */
  EventName name();
}
