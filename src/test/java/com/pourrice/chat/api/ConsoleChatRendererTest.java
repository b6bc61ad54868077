package com.pourrice.chat.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pourrice.chat.domain.chat.ChatMessage;
import com.pourrice.chat.domain.chat.HistoryOutcome;
import com.pourrice.chat.domain.chat.RoomId;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConsoleChatRendererTest {
  private static final RoomId ROOM = RoomId.forRestaurant("r42");

  private final StringWriter buffer = new StringWriter();
  private final ConsoleChatRenderer renderer = new ConsoleChatRenderer("diner-1");

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void formatsOwnAndOtherMessages() {
    ChatMessage mine = new ChatMessage("m1", ROOM, "diner-1", "Dana", "hi", null, "", null);
    ChatMessage theirs = new ChatMessage("m2", ROOM, "owner-7", "", "", "https://cdn.test/dish.png", "", null);

    assertEquals("[restaurant-r42] you: hi", renderer.format(mine));
    assertEquals("[restaurant-r42] owner-7: <image https://cdn.test/dish.png>", renderer.format(theirs));
  }

  @Test
  void historyPrintsCountThenMessages() {
    ChatMessage message = new ChatMessage("m1", ROOM, "owner-7", "Chef Li", "welcome", null, "", null);

    renderer.onHistoryLoaded(ROOM, HistoryOutcome.RECEIVED, List.of(message));

    String out = buffer.toString();
    assertTrue(out.contains("* 1 message(s) in restaurant-r42"));
    assertTrue(out.contains("[restaurant-r42] Chef Li: welcome"));
  }

  @Test
  void timedOutHistoryIsReported() {
    renderer.onHistoryLoaded(ROOM, HistoryOutcome.TIMED_OUT, List.of());

    assertTrue(buffer.toString().contains("history of restaurant-r42 is unavailable"));
  }
}
