package com.pourrice.chat.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation for chat configuration and CLI input.
 * <p><strong>Role:</strong> Applied before identities, room ids and credentials reach the session or the network.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> No logs; failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9._:-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics; {@code null} means {@code "value"}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a user or restaurant identifier. Identifiers end up inside room ids such as
   * {@code restaurant-<id>}, so only {@code [A-Za-z0-9._:-]} is accepted.
   *
   * @param name parameter name for diagnostics
   * @param value candidate identifier
   * @return trimmed identifier
   * @throws IllegalArgumentException if the identifier is blank or has unsupported characters
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, colon, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII and fits the length limit. Used for values that end up in HTTP
   * headers or OpenTelemetry resource attributes.
   *
   * @param name parameter name for diagnostics
   * @param value candidate string
   * @param maxLength maximum length in characters
   * @return trimmed value
   * @throws IllegalArgumentException if the value is too long or has characters outside {@code 0x20-0x7E}
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    if (maxLength < 1) {
      throw new IllegalArgumentException("maxLength must be positive (was " + maxLength + ")");
    }
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
