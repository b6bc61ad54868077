package com.pourrice.chat.domain.error;

/**
 * Thrown when a connection is requested without a local user identity.
 *
 * @since 0.1.0
 */
public final class NotAuthenticatedException extends ChatException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public NotAuthenticatedException(String message) {
    super(ChatErrorCode.NOT_AUTHENTICATED, message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause underlying failure
   */
  public NotAuthenticatedException(String message, Throwable cause) {
    super(ChatErrorCode.NOT_AUTHENTICATED, message, cause);
  }
}
