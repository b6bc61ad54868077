package com.pourrice.chat.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseInRangeAcceptsBounds() {
    assertEquals(1L, Numbers.parseInRange("historyTimeoutMillis", "1", 1, 600_000));
    assertEquals(600_000L, Numbers.parseInRange("historyTimeoutMillis", " 600000 ", 1, 600_000));
  }

  @Test
  void parseInRangeRejectsNonNumeric() {
    IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInRange("reconnect.maxAttempts", "five", 0, 100));
    assertEquals("reconnect.maxAttempts must be numeric (was five)", error.getMessage());
  }

  @Test
  void requireRangeRejectsOutOfBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("port", 0, 1, 65535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("port", 70000, 1, 65535));
  }
}
