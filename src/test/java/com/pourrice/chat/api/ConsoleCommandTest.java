package com.pourrice.chat.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConsoleCommandTest {

  @Test
  void plainTextIsSaid() {
    ConsoleCommand command = ConsoleCommand.parse("  hello there  ").orElseThrow();

    assertEquals(ConsoleCommand.Kind.SAY, command.kind());
    assertEquals("hello there", command.text());
  }

  @Test
  void blankLineYieldsNothing() {
    assertTrue(ConsoleCommand.parse("   ").isEmpty());
    assertTrue(ConsoleCommand.parse(null).isEmpty());
  }

  @Test
  void imageKeepsPathWithSpaces() {
    ConsoleCommand command = ConsoleCommand.parse("/image /tmp/my photos/dish.png").orElseThrow();

    assertEquals(ConsoleCommand.Kind.IMAGE, command.kind());
    assertEquals("/tmp/my photos/dish.png", command.target());
  }

  @Test
  void privateMessageSplitsRecipientAndText() {
    ConsoleCommand command = ConsoleCommand.parse("/pm owner-7 is the table ready?").orElseThrow();

    assertEquals(ConsoleCommand.Kind.PRIVATE, command.kind());
    assertEquals("owner-7", command.target());
    assertEquals("is the table ready?", command.text());
  }

  @Test
  void simpleCommands() {
    assertEquals(ConsoleCommand.Kind.CLEAR, ConsoleCommand.parse("/clear").orElseThrow().kind());
    assertEquals(ConsoleCommand.Kind.LEAVE, ConsoleCommand.parse("/leave").orElseThrow().kind());
    assertEquals(ConsoleCommand.Kind.QUIT, ConsoleCommand.parse("/exit").orElseThrow().kind());
    assertEquals(ConsoleCommand.Kind.HELP, ConsoleCommand.parse("/help").orElseThrow().kind());
  }

  @Test
  void rejectsUnknownCommandsAndMissingArguments() {
    assertThrows(IllegalArgumentException.class, () -> ConsoleCommand.parse("/dance"));
    assertThrows(IllegalArgumentException.class, () -> ConsoleCommand.parse("/image"));
    assertThrows(IllegalArgumentException.class, () -> ConsoleCommand.parse("/pm owner-7"));
  }
}
