package com.pourrice.chat.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private static final String NAME = "com.pourrice.chat.logging.sample";

  @AfterEach
  void tearDown() {
    ((Logger) LoggerFactory.getLogger(NAME)).setLevel(null);
  }

  @Test
  void setLevelUpdatesNamedLogger() {
    LoggingConfigurator.setLevel(NAME, "WARN");

    assertEquals(Level.WARN, ((Logger) LoggerFactory.getLogger(NAME)).getLevel());
  }

  @Test
  void unknownLevelFallsBackToDebug() {
    LoggingConfigurator.setLevel(NAME, "chatty");

    assertEquals(Level.DEBUG, ((Logger) LoggerFactory.getLogger(NAME)).getLevel());
  }
}
