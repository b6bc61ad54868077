package com.pourrice.chat.domain.error;

/**
 * Image upload to the image store failed. Staging is cleared; no retry is attempted.
 *
 * @since 0.1.0
 */
public final class UploadFailedException extends ChatException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public UploadFailedException(String message) {
    super(ChatErrorCode.UPLOAD_FAILED, message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause transport or server failure
   */
  public UploadFailedException(String message, Throwable cause) {
    super(ChatErrorCode.UPLOAD_FAILED, message, cause);
  }
}
