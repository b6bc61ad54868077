package com.pourrice.chat.domain.error;

import java.util.Objects;

/**
 * <strong>What:</strong> Base type of the recoverable chat failures.
 * <p><strong>Why:</strong> Asynchronous operations complete their futures exceptionally with a subtype so callers
 * can branch on {@link #code()} without parsing messages.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public abstract class ChatException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ChatErrorCode code;

  protected ChatException(ChatErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  protected ChatException(ChatErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  /**
   * Returns the stable error code.
   *
   * @return error code
   */
  public ChatErrorCode code() {
    return code;
  }

  /**
   * Returns the message to present to the user.
   *
   * @return user-facing message for {@link #code()}
   */
  public String userMessage() {
    return code.userMessage();
  }
}
