package com.pourrice.chat.api;

import com.pourrice.chat.application.chat.ChatSession;
import com.pourrice.chat.domain.chat.ImageFile;
import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.error.ChatException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads console lines and turns them into session intents for one room.
 */
final class ChatConsole {
  private static final Logger log = LoggerFactory.getLogger(ChatConsole.class);
  private static final long LEAVE_TIMEOUT_MILLIS = 5_000L;

  private final ChatSession session;
  private final RoomId room;

  ChatConsole(ChatSession session, RoomId room) {
    this.session = Objects.requireNonNull(session, "session");
    this.room = Objects.requireNonNull(room, "room");
  }

  /**
   * Reads until end of input, {@code /quit} or {@code /leave}.
   *
   * @param in console input
   * @throws IOException when reading fails
   */
  void run(BufferedReader in) throws IOException {
    String line;
    while ((line = in.readLine()) != null) {
      if (!handle(line)) {
        return;
      }
    }
    log.debug("Console input closed");
  }

  /**
   * Handles one line.
   *
   * @param line raw console line
   * @return {@code false} when the console should stop reading
   */
  boolean handle(String line) {
    Optional<ConsoleCommand> parsed;
    try {
      parsed = ConsoleCommand.parse(line);
    } catch (IllegalArgumentException ex) {
      CliPrinter.println("! " + ex.getMessage());
      return true;
    }
    if (parsed.isEmpty()) {
      return true;
    }
    ConsoleCommand command = parsed.get();
    switch (command.kind()) {
      case SAY -> report(session.send(room, command.text()));
      case IMAGE -> stageImage(command.target());
      case CLEAR -> report(session.clearImage());
      case PRIVATE -> report(session.sendPrivate(command.target(), command.text()));
      case HELP -> CliPrinter.println(ConsoleCommand.HELP_TEXT);
      case LEAVE -> {
        leave();
        return false;
      }
      case QUIT -> {
        return false;
      }
    }
    return true;
  }

  private void stageImage(String rawPath) {
    ImageFile file;
    try {
      file = ImageFile.fromPath(Path.of(rawPath));
    } catch (InvalidPathException ex) {
      CliPrinter.println("! invalid path: " + rawPath);
      return;
    } catch (IOException ex) {
      CliPrinter.println("! cannot read " + rawPath + ": " + ex.getMessage());
      return;
    }
    try {
      // Upload failures reach the renderer through onError.
      session.selectImage(file).whenComplete((uploaded, error) -> {
        if (error != null && !(unwrap(error) instanceof ChatException)) {
          CliPrinter.println("! " + unwrap(error).getMessage());
        }
      });
    } catch (IllegalArgumentException ex) {
      CliPrinter.println("! " + ex.getMessage());
    }
  }

  private void leave() {
    try {
      session.closeRoom(room).get(LEAVE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
      CliPrinter.println("* left " + room);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while leaving {}", room);
    } catch (ExecutionException ex) {
      CliPrinter.println("! " + describe(ex.getCause()));
    } catch (TimeoutException ex) {
      log.warn("Leave of {} did not complete within {} ms", room, LEAVE_TIMEOUT_MILLIS);
    }
  }

  private static void report(CompletableFuture<?> future) {
    future.whenComplete((ignored, error) -> {
      if (error != null) {
        CliPrinter.println("! " + describe(unwrap(error)));
      }
    });
  }

  private static String describe(Throwable error) {
    if (error instanceof ChatException chat) {
      return chat.userMessage();
    }
    return error == null ? "unknown error" : error.getMessage();
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
