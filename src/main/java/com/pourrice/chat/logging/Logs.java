package com.pourrice.chat.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers for chat content and credentials.
 * <p><strong>Why:</strong> Message bodies and raw frames are user content and may be large; auth tokens must never
 * reach operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncating mid-codepoint never fails.
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final int VISIBLE_TOKEN_SUFFIX = 4;

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  /**
   * Masks a bearer token, keeping only its last characters for correlation.
   *
   * @param token token; may be {@code null}
   * @return e.g. {@code [REDACTED]...a1b2}, or {@code [REDACTED]} for short or missing tokens
   */
  public static String maskToken(String token) {
    if (token == null || token.length() <= VISIBLE_TOKEN_SUFFIX * 2) {
      return REDACTED_PLACEHOLDER;
    }
    return REDACTED_PLACEHOLDER + "..." + token.substring(token.length() - VISIBLE_TOKEN_SUFFIX);
  }
}
