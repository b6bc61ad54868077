package com.pourrice.chat.domain.chat;

/**
 * Ordered pipeline a chat session moves through before room operations may leave the client.
 *
 * @since 0.1.0
 */
public enum SessionState {
  /** No connection. */
  IDLE,
  /** Transport is opening or reconnecting. */
  CONNECTING,
  /** Connected; waiting for the server to acknowledge {@code register}. */
  AWAITING_REGISTRATION,
  /** Connected and registered; queued room intents are processed. */
  READY;

  /**
   * Derives the pipeline state from connection and registration state.
   *
   * @param connection current connection state
   * @param registered whether registration was acknowledged
   * @return pipeline state
   */
  public static SessionState derive(ConnectionState connection, boolean registered) {
    return switch (connection) {
      case DISCONNECTED -> IDLE;
      case CONNECTING -> CONNECTING;
      case CONNECTED -> registered ? READY : AWAITING_REGISTRATION;
    };
  }
}
