package com.pourrice.chat.domain.error;

/**
 * Signals a room operation attempted before registration was acknowledged.
 *
 * @since 0.1.0
 */
public final class NotRegisteredException extends ChatException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public NotRegisteredException(String message) {
    super(ChatErrorCode.NOT_REGISTERED, message);
  }
}
