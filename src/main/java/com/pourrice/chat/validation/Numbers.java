package com.pourrice.chat.validation;

/**
 * Numeric range checks for chat timing and size settings.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value lies in {@code [min, max]}.
   *
   * @param name parameter name for diagnostics
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return the value
   * @throws IllegalArgumentException if the value is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal string and range checks it.
   *
   * @param name parameter name for diagnostics
   * @param raw text to parse
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a number or is out of range
   */
  public static long parseInRange(String name, String raw, long min, long max) {
    String sanitized = Strings.requireNonBlank(name, raw);
    long value;
    try {
      value = Long.parseLong(sanitized);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name) + " must be numeric (was " + sanitized + ")", ex);
    }
    return requireRange(name, value, min, max);
  }
}
