package com.pourrice.chat.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("hello", Logs.truncate("hello", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void truncateCutsLongValuesOnByteBudget() {
    String truncated = Logs.truncate("abcdefghij", 4);

    assertTrue(truncated.startsWith("abcd... (truncated, 4 of 10 bytes)"), truncated);
  }

  @Test
  void truncateDropsSplitCodepoint() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é..."), truncated);
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void maskTokenKeepsOnlySuffix() {
    assertEquals("[REDACTED]...7890", Logs.maskToken("eyJhbGciOi1234567890"));
    assertEquals("[REDACTED]", Logs.maskToken("short"));
    assertEquals("[REDACTED]", Logs.maskToken(null));
  }
}
