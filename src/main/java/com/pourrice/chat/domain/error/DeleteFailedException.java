package com.pourrice.chat.domain.error;

/**
 * Deleting an uploaded but unsent image failed. Non-fatal; no retry is attempted.
 *
 * @since 0.1.0
 */
public final class DeleteFailedException extends ChatException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public DeleteFailedException(String message) {
    super(ChatErrorCode.DELETE_FAILED, message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause transport or server failure
   */
  public DeleteFailedException(String message, Throwable cause) {
    super(ChatErrorCode.DELETE_FAILED, message, cause);
  }
}
