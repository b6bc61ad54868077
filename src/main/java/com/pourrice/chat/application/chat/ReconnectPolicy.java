package com.pourrice.chat.application.chat;

/**
 * Capped exponential backoff used after an unexpected connection loss.
 *
 * @param initialDelayMillis delay before the first retry; positive
 * @param maxDelayMillis cap applied to every delay; at least {@code initialDelayMillis}
 * @param maxAttempts retries before giving up; zero disables reconnection
 * @since 0.1.0
 */
public record ReconnectPolicy(long initialDelayMillis, long maxDelayMillis, int maxAttempts) {

  /** 1000 ms doubling up to 5000 ms, five attempts. */
  public static final ReconnectPolicy DEFAULT = new ReconnectPolicy(1_000L, 5_000L, 5);

  public ReconnectPolicy {
    if (initialDelayMillis <= 0) {
      throw new IllegalArgumentException("initialDelayMillis must be positive");
    }
    if (maxDelayMillis < initialDelayMillis) {
      throw new IllegalArgumentException("maxDelayMillis must be >= initialDelayMillis");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must be >= 0");
    }
  }

  /**
   * Returns the delay before the given retry.
   *
   * @param attempt zero-based retry index
   * @return {@code min(maxDelayMillis, initialDelayMillis * 2^attempt)}
   */
  public long delayForAttempt(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0");
    }
    long delay = initialDelayMillis;
    for (int i = 0; i < attempt && delay < maxDelayMillis; i++) {
      delay = delay * 2;
    }
    return Math.min(delay, maxDelayMillis);
  }
}
