package com.pourrice.chat.application.port;

import com.pourrice.chat.domain.protocol.InboundEvent;

/**
 * Callbacks raised by a {@link TransportPort} for one opened connection.
 *
 * <p>Callbacks arrive on the transport's own threads; receivers hop onto the event loop.</p>
 *
 * @since 0.1.0
 */
public interface TransportListener {
  /** The connection was established. */
  void onOpen();

  /**
   * A decoded event arrived.
   *
   * @param event inbound event
   */
  void onEvent(InboundEvent event);

  /**
   * The connection closed without a local close request.
   *
   * @param reason close reason reported by the peer; may be empty
   */
  void onClosed(String reason);

  /**
   * The connection could not be opened or failed while open.
   *
   * @param error failure cause
   */
  void onFailure(Throwable error);
}
