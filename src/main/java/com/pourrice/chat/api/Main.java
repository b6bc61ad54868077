package com.pourrice.chat.api;

import com.pourrice.chat.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: pourrice-chat <chat> [options]";
  private static final String HELP_TEXT = """
      PourRice chat client

      Usage:
        pourrice-chat <command> [options]

      Commands:
        chat        Console chat on a restaurant room (chat --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

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
    String[] safeArgs = args == null ? new String[0] : args;
    CliInput input;
    try {
      input = CliInput.parse(safeArgs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = firstCommand(safeArgs);
    if (command == null) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    String[] delegateArgs = withoutFirst(safeArgs, command);
    return switch (command.toLowerCase(Locale.ROOT)) {
      case "chat" -> ChatCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String firstCommand(String[] args) {
    for (String arg : args) {
      if (arg != null && !arg.isBlank() && !arg.startsWith("-") && !arg.contains("=")) {
        return arg.trim();
      }
    }
    return null;
  }

  private static String[] withoutFirst(String[] args, String command) {
    String[] rest = new String[args.length - 1];
    int out = 0;
    boolean skipped = false;
    for (String arg : args) {
      if (!skipped && arg != null && arg.trim().equals(command)) {
        skipped = true;
        continue;
      }
      if (out < rest.length) {
        rest[out++] = arg;
      }
    }
    return Arrays.copyOf(rest, out);
  }
}
