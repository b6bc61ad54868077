package com.pourrice.chat.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ChatCliTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ChatCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, ChatCli.run(new String[] {"--help"}, new StringReader("")));
    assertTrue(buffer.toString().contains("restaurantId=ID"));
  }

  @Test
  void dryRunPrintsPlanWithoutConnecting() {
    ExitCode code = ChatCli.run(new String[] {
        "socketUrl=wss://chat.pourrice.test/chat", "userId=diner-1", "email=dana@example.com",
        "authToken=secret-token", "restaurantId=r42", "--dry-run"}, new StringReader(""));

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Chat dry-run: no connection will be opened."));
    assertTrue(out.contains("wss://chat.pourrice.test/chat"));
    assertTrue(out.contains("dana@example.com"));
    assertTrue(out.contains("restaurant-r42"));
    assertTrue(out.contains("<disabled>"));
    assertFalse(out.contains("secret-token"));
  }

  @Test
  void missingUserIsInvalidArgs() {
    ExitCode code = ChatCli.run(new String[] {"restaurantId=r42", "--dry-run"}, new StringReader(""));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: chat"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("userId and restaurantId are required")));
  }

  @Test
  void malformedArgumentIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, ChatCli.run(new String[] {"userId"}, new StringReader("")));
  }

  @Test
  void invalidValueIsConfigError() {
    ExitCode code = ChatCli.run(new String[] {
        "userId=diner-1", "restaurantId=r42", "socketUrl=ftp://chat.test", "--dry-run"}, new StringReader(""));

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void missingConfigFileIsInvalidArgs() {
    ExitCode code = ChatCli.run(new String[] {
        "config=" + tempDir.resolve("missing.yaml"), "--dry-run"}, new StringReader(""));

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void yamlSuppliesValuesAndCliOverridesThem() throws IOException {
    Path yaml = tempDir.resolve("chat.yaml");
    Files.writeString(yaml, """
        chat:
          userId: diner-1
          restaurantId: r1
        """);

    ExitCode code = ChatCli.run(new String[] {"config=" + yaml, "restaurantId=r42", "--dry-run"},
        new StringReader(""));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("restaurant-r42"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
        && event.getFormattedMessage().contains("CLI overrides YAML for key: restaurantId")));
  }

  @Test
  void unknownOptionIsInvalidArgs() {
    ExitCode code = ChatCli.run(new String[] {"userId=diner-1", "restaurantId=r42", "--dryrun"},
        new StringReader(""));

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("Unknown option --dryrun")));
  }

  @Test
  void unknownYamlSettingIsConfigError() throws IOException {
    Path yaml = tempDir.resolve("typo.yaml");
    Files.writeString(yaml, """
        chat:
          userId: diner-1
          restaurant: r1
        """);

    ExitCode code = ChatCli.run(new String[] {"config=" + yaml, "restaurantId=r42", "--dry-run"},
        new StringReader(""));

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("restaurant")));
  }
}
