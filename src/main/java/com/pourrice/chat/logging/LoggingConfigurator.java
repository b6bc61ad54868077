package com.pourrice.chat.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts Logback levels from CLI flags.
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger to DEBUG for {@code --verbose}.
   */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, "DEBUG");
  }

  /**
   * Sets the level of one logger.
   *
   * @param loggerName logger name, e.g. {@code com.pourrice.chat.application.chat}
   * @param level level name such as {@code INFO}; unknown names fall back to {@code DEBUG}
   */
  public static void setLevel(String loggerName, String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      Level next = Level.toLevel(level, Level.DEBUG);
      if (!next.equals(target.getLevel())) {
        target.setLevel(next);
      }
      return;
    }
    log.warn("Log level change requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
