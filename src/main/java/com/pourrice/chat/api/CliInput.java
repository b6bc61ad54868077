package com.pourrice.chat.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Chat CLI arguments: the switches the console understands plus the {@code key=value} settings.
 *
 * @param settings {@code key=value} arguments in the order given
 * @param help {@code --help}, {@code -h} or {@code help} was given
 * @param verbose {@code --verbose}, {@code -v} or {@code --debug} was given
 * @param dryRun {@code --dry-run} was given; print the resolved settings instead of connecting
 */
record CliInput(List<String> settings, boolean help, boolean verbose, boolean dryRun) {

  CliInput {
    settings = List.copyOf(settings);
  }

  /**
   * Sorts raw arguments into switches and settings.
   *
   * @param args raw CLI arguments; may be {@code null}, blank entries are skipped
   * @return parsed arguments
   * @throws IllegalArgumentException on a switch the chat console does not know
   */
  static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    boolean dryRun = false;
    for (String raw : args == null ? new String[0] : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      switch (arg.toLowerCase(Locale.ROOT)) {
        case "--help", "-h", "help" -> help = true;
        case "--verbose", "-v", "--debug" -> verbose = true;
        case "--dry-run" -> dryRun = true;
        default -> {
          if (arg.startsWith("-") && !arg.contains("=")) {
            throw new IllegalArgumentException("Unknown option " + arg);
          }
          settings.add(arg);
        }
      }
    }
    return new CliInput(settings, help, verbose, dryRun);
  }

  /**
   * Returns the settings as an array for {@link CliArgsParser#toMap(String[])}.
   *
   * @return {@code key=value} arguments
   */
  String[] keyValueArgs() {
    return settings.toArray(String[]::new);
  }
}
