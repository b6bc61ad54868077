package com.pourrice.chat.domain.chat;

import java.util.Locale;

/**
 * Content kind of a chat message as tagged by the server.
 *
 * @since 0.1.0
 */
public enum MessageKind {
  TEXT,
  IMAGE,
  FILE;

  /**
   * Resolves the wire tag, falling back to {@link #IMAGE} when an image is attached and {@link #TEXT} otherwise.
   *
   * @param raw wire value such as {@code "image"}; may be {@code null}
   * @param hasImage whether the message carries an image URL
   * @return resolved kind
   */
  public static MessageKind fromWire(String raw, boolean hasImage) {
    if (raw != null && !raw.isBlank()) {
      switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "text":
          return TEXT;
        case "image":
          return IMAGE;
        case "file":
          return FILE;
        default:
          break;
      }
    }
    return hasImage ? IMAGE : TEXT;
  }

  /**
   * Returns the lowercase tag used on the wire.
   *
   * @return wire tag
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
