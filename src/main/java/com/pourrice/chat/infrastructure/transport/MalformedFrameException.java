package com.pourrice.chat.infrastructure.transport;

/**
 * Checked exception raised when an inbound frame is not a valid chat event.
 *
 * @since 0.1.0
 */
public final class MalformedFrameException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public MalformedFrameException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause JSON parsing failure
   */
  public MalformedFrameException(String msg, Throwable cause) { super(msg, cause); }
}
