package com.pourrice.chat.api;

import java.util.Objects;
import java.util.Optional;

/**
 * One line of console input.
 *
 * @param kind command kind
 * @param target recipient for {@link Kind#PRIVATE}, image path for {@link Kind#IMAGE}; otherwise empty
 * @param text message text for {@link Kind#SAY} and {@link Kind#PRIVATE}; otherwise empty
 */
record ConsoleCommand(ConsoleCommand.Kind kind, String target, String text) {

  enum Kind {
    SAY,
    IMAGE,
    CLEAR,
    PRIVATE,
    LEAVE,
    QUIT,
    HELP
  }

  static final String HELP_TEXT = """
      Commands:
        <text>              send a message (with the staged image, if any)
        /image <path>       stage and upload an image for the next message
        /clear              discard the staged image
        /pm <userId> <text> send a private message
        /leave              leave the room and exit
        /quit               exit
        /help               show this message""";

  ConsoleCommand {
    Objects.requireNonNull(kind, "kind");
    target = Objects.requireNonNullElse(target, "");
    text = Objects.requireNonNullElse(text, "");
  }

  /**
   * Parses a console line.
   *
   * @param line raw line
   * @return command, or empty for a blank line
   * @throws IllegalArgumentException for unknown commands or missing arguments
   */
  static Optional<ConsoleCommand> parse(String line) {
    if (line == null || line.isBlank()) {
      return Optional.empty();
    }
    String trimmed = line.strip();
    if (!trimmed.startsWith("/")) {
      return Optional.of(new ConsoleCommand(Kind.SAY, "", trimmed));
    }
    String[] parts = trimmed.split("\\s+", 3);
    String name = parts[0];
    return Optional.of(switch (name) {
      case "/image" -> {
        if (parts.length < 2) {
          throw new IllegalArgumentException("usage: /image <path>");
        }
        yield new ConsoleCommand(Kind.IMAGE, trimmed.substring(name.length()).strip(), "");
      }
      case "/pm" -> {
        if (parts.length < 3) {
          throw new IllegalArgumentException("usage: /pm <userId> <text>");
        }
        yield new ConsoleCommand(Kind.PRIVATE, parts[1], parts[2]);
      }
      case "/clear" -> new ConsoleCommand(Kind.CLEAR, "", "");
      case "/leave" -> new ConsoleCommand(Kind.LEAVE, "", "");
      case "/quit", "/exit" -> new ConsoleCommand(Kind.QUIT, "", "");
      case "/help" -> new ConsoleCommand(Kind.HELP, "", "");
      default -> throw new IllegalArgumentException("unknown command " + name + " (try /help)");
    });
  }
}
