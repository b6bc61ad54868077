package com.pourrice.chat.api;

/**
 * <strong>What:</strong> Process exit codes of the chat CLI.
 * <p><strong>Thread-safety:</strong> Immutable enum.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Session ended normally. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure reading configuration or console input. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** No signed-in user or the server refused the session. */
  AUTH_FAILURE(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
