package com.pourrice.chat.domain.error;

/**
 * Stable error codes attached to {@link ChatException}s.
 *
 * @since 0.1.0
 */
public enum ChatErrorCode {
  /** No local identity is available when connecting. */
  NOT_AUTHENTICATED("Sign in to use chat."),
  /** Operation attempted while the transport is disconnected. */
  NOT_CONNECTED("Chat is currently unavailable."),
  /** Room operation attempted before the server acknowledged registration. */
  NOT_REGISTERED("Chat is still connecting."),
  /** Image upload failed. */
  UPLOAD_FAILED("The image could not be uploaded."),
  /** Removal of an unsent image failed. */
  DELETE_FAILED("The discarded image could not be removed.");

  private final String userMessage;

  ChatErrorCode(String userMessage) {
    this.userMessage = userMessage;
  }

  /**
   * Returns a short message suitable for showing to the user.
   *
   * @return user-facing message
   */
  public String userMessage() {
    return userMessage;
  }
}
