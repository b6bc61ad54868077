package com.pourrice.chat.application.chat;

import java.net.URI;
import java.util.Objects;

/**
 * Tunables of a chat session.
 *
 * @param socketUri chat server endpoint
 * @param reconnect backoff applied after connection loss
 * @param historyTimeoutMillis wait for a history snapshot after a join
 * @param typingIdleMillis idle time after which the local user stops typing
 * @param typingExpiryMillis lifetime of a remote typing indicator without refresh
 * @param attachmentMaxBytes largest image accepted for upload
 * @since 0.1.0
 */
public record ChatSettings(
    URI socketUri,
    ReconnectPolicy reconnect,
    long historyTimeoutMillis,
    long typingIdleMillis,
    long typingExpiryMillis,
    long attachmentMaxBytes) {

  public static final long DEFAULT_HISTORY_TIMEOUT_MILLIS = 8_000L;
  public static final long DEFAULT_TYPING_IDLE_MILLIS = 2_000L;
  public static final long DEFAULT_TYPING_EXPIRY_MILLIS = 3_000L;
  public static final long DEFAULT_ATTACHMENT_MAX_BYTES = 10L * 1024 * 1024;

  public ChatSettings {
    Objects.requireNonNull(socketUri, "socketUri");
    Objects.requireNonNull(reconnect, "reconnect");
    requirePositive(historyTimeoutMillis, "historyTimeoutMillis");
    requirePositive(typingIdleMillis, "typingIdleMillis");
    requirePositive(typingExpiryMillis, "typingExpiryMillis");
    requirePositive(attachmentMaxBytes, "attachmentMaxBytes");
  }

  /**
   * Settings with every default applied.
   *
   * @param socketUri chat server endpoint
   * @return default settings
   */
  public static ChatSettings defaults(URI socketUri) {
    return new ChatSettings(
        socketUri,
        ReconnectPolicy.DEFAULT,
        DEFAULT_HISTORY_TIMEOUT_MILLIS,
        DEFAULT_TYPING_IDLE_MILLIS,
        DEFAULT_TYPING_EXPIRY_MILLIS,
        DEFAULT_ATTACHMENT_MAX_BYTES);
  }

  private static void requirePositive(long value, String name) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
