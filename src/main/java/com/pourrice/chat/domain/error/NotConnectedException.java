package com.pourrice.chat.domain.error;

/**
 * Signals an operation attempted while the chat transport is disconnected.
 *
 * @since 0.1.0
 */
public final class NotConnectedException extends ChatException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public NotConnectedException(String message) {
    super(ChatErrorCode.NOT_CONNECTED, message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause underlying failure
   */
  public NotConnectedException(String message, Throwable cause) {
    super(ChatErrorCode.NOT_CONNECTED, message, cause);
  }
}
