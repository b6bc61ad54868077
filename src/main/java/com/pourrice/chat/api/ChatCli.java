package com.pourrice.chat.api;

import com.pourrice.chat.application.chat.ChatSession;
import com.pourrice.chat.config.ChatConfig;
import com.pourrice.chat.config.ChatDefaults;
import com.pourrice.chat.config.ChatRuntime;
import com.pourrice.chat.config.CompositionRoot;
import com.pourrice.chat.config.ConfigMerger;
import com.pourrice.chat.config.YamlConfigLoader;
import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.chat.UserIdentity;
import com.pourrice.chat.domain.error.NotAuthenticatedException;
import com.pourrice.chat.logging.LoggingConfigurator;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console chat on a restaurant's room.
 *
 * @since 0.1.0
 */
public final class ChatCli {
  private static final Logger log = LoggerFactory.getLogger(ChatCli.class);
  private static final long CONNECT_SLACK_MILLIS = 10_000L;
  private static final String SUMMARY_USAGE =
      "usage: chat [config=PATH] socketUrl=URL userId=ID authToken=TOKEN restaurantId=ID "
          + "[displayName=NAME] [apiBaseUrl=URL] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      PourRice console chat

      Usage:
        chat [options]

      Connection:
        socketUrl=URL              Chat server WebSocket endpoint (ws, wss, http or https)
        userId=ID                  Signed-in user id (required)
        displayName=NAME           Name shown to other participants (default: email, then Anonymous)
        authToken=TOKEN            Bearer token sent with every authorized request
        restaurantId=ID            Opens the room restaurant-<ID> (required)

      Images:
        apiBaseUrl=URL             Image API base URL; image uploads are disabled when unset
        uploadPath=PATH            Upload path (default API/Images/upload)
        deletePath=PATH            Delete path (default API/Images/delete)
        uploadFolder=NAME          Storage folder (default Chat)
        apiPasscode=VALUE          Sent as x-api-passcode

      Tuning:
        reconnect.initialDelayMillis, reconnect.maxDelayMillis, reconnect.maxAttempts
        historyTimeoutMillis, typing.idleMillis, typing.expiryMillis, attachment.maxBytes
        metricsExporter=otlp|none  OpenTelemetry metrics export (default none)
        otelEndpoint=URL           OTLP gRPC endpoint
        otelResourceAttributes=K=V,...

      Global options:
        config=PATH                YAML file with common and chat sections; CLI values win
        --dry-run                  Validate configuration and print it without connecting
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ChatCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, new InputStreamReader(System.in, StandardCharsets.UTF_8));
  }

  /**
   * Runs the console chat.
   *
   * @param args raw CLI arguments
   * @param console console input
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args, Reader console) {
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for chat CLI");
    }

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml;
    if (configPath == null) {
      yaml = Optional.empty();
    } else {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    ChatConfig config;
    try {
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(yaml, cliKv, ChatDefaults.asFlatMap(), log::warn);
      config = ChatConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid chat configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }
    if (config.verbose() && !input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    if (config.identity().isEmpty() || config.restaurantId().isEmpty()) {
      log.error("userId and restaurantId are required");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    try (ChatRuntime runtime = new CompositionRoot(config).chatRuntime(
        new ConsoleChatRenderer(config.identity().get().userId()))) {
      return chat(runtime.session(), config, new BufferedReader(console));
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in chat session", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode chat(ChatSession session, ChatConfig config, BufferedReader console) {
    RoomId room = RoomId.forRestaurant(config.restaurantId().get());
    long connectTimeout = connectBudgetMillis(config);
    try {
      session.open().get(connectTimeout, TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return ExitCode.INTERRUPTED;
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof NotAuthenticatedException) {
        log.error("Not signed in: {}", ex.getCause().getMessage());
        return ExitCode.AUTH_FAILURE;
      }
      log.error("Could not connect to {}: {}", config.socketUri(), ex.getCause().getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (TimeoutException ex) {
      log.error("Could not connect to {} within {} ms", config.socketUri(), connectTimeout);
      return ExitCode.RUNTIME_FAILURE;
    }

    session.setRoomVisible(room, true);
    session.openRoom(config.restaurantId().get()).whenComplete((joined, error) -> {
      if (error != null) {
        CliPrinter.println("! could not join " + room + ": " + error.getMessage());
      } else if (!joined) {
        CliPrinter.println("! could not join " + room);
      }
    });
    CliPrinter.println("* chatting in " + room + " as "
        + config.identity().map(UserIdentity::effectiveDisplayName).orElse("") + " (/help for commands)");
    try {
      new ChatConsole(session, room).run(console);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Console input failed", ex);
      return ExitCode.IO_ERROR;
    }
  }

  private static long connectBudgetMillis(ChatConfig config) {
    var reconnect = config.session().reconnect();
    long total = CONNECT_SLACK_MILLIS;
    for (int attempt = 0; attempt < reconnect.maxAttempts(); attempt++) {
      total += reconnect.delayForAttempt(attempt);
    }
    return total;
  }

  private static void printDryRunPlan(ChatConfig config) {
    CliPrinter.printLines(
        "Chat dry-run: no connection will be opened.",
        " Socket URL       : " + config.socketUri(),
        " User             : " + config.identity().map(UserIdentity::userId).orElse("<none>"),
        " Display name     : " + config.identity().map(UserIdentity::effectiveDisplayName).orElse("<none>"),
        " Room             : " + RoomId.forRestaurant(config.restaurantId().orElseThrow()),
        " Image API        : " + config.apiBaseUri().map(Object::toString).orElse("<disabled>"),
        " Reconnect        : " + config.session().reconnect(),
        " History timeout  : " + config.session().historyTimeoutMillis() + " ms",
        " Metrics exporter : " + config.telemetry().exporter());
  }
}
