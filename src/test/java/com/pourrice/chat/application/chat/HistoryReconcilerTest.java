package com.pourrice.chat.application.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pourrice.chat.domain.chat.ChatMessage;
import com.pourrice.chat.domain.chat.HistoryOutcome;
import com.pourrice.chat.domain.chat.HistorySnapshot;
import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.protocol.EventName;
import com.pourrice.chat.domain.protocol.JoinAck;
import com.pourrice.chat.testutil.RecordingChatListener;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class HistoryReconcilerTest {
  private static final RoomId ROOM = SessionFixture.ROOM;

  @Test
  void joinArmsHistoryAndSnapshotReplacesTimeline() {
    SessionFixture fixture = new SessionFixture().ready();
    fixture.session.joinRoom(ROOM);
    CompletableFuture<HistoryOutcome> outcome = fixture.session.historyOutcome(ROOM).orElseThrow();
    assertTrue(fixture.session.isHistoryLoading(ROOM));

    fixture.transport.deliver(EventName.JOINED_ROOM, new JoinAck(ROOM, true));
    fixture.transport.deliver(EventName.MESSAGE_HISTORY, new HistorySnapshot(ROOM, List.of(
        SessionFixture.message("h1", ROOM, "owner-7", "older"),
        SessionFixture.message("h2", ROOM, SessionFixture.SELF, "newer"),
        SessionFixture.message("h1", ROOM, "owner-7", "older"))));

    assertEquals(HistoryOutcome.RECEIVED, outcome.getNow(null));
    assertFalse(fixture.session.isHistoryLoading(ROOM));
    assertEquals(List.of("h1", "h2"), fixture.session.messages(ROOM).stream().map(ChatMessage::messageId).toList());
    assertEquals(List.of(ROOM.value() + "=true", ROOM.value() + "=false"), fixture.listener.historyLoading);
    assertEquals(1, fixture.metrics.count("chat.history.received"));
  }

  @Test
  void missingHistoryTimesOutAndLateSnapshotIsIgnored() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    CompletableFuture<HistoryOutcome> outcome = fixture.session.historyOutcome(ROOM).orElseThrow();

    fixture.scheduler.advance(7_999L);
    assertTrue(fixture.session.isHistoryLoading(ROOM));
    fixture.scheduler.advance(1L);

    assertEquals(HistoryOutcome.TIMED_OUT, outcome.getNow(null));
    assertEquals(1, fixture.metrics.count("chat.history.timeout"));

    fixture.transport.deliver(EventName.MESSAGE_HISTORY,
        new HistorySnapshot(ROOM, List.of(SessionFixture.message("h1", ROOM, "owner-7", "late"))));

    assertTrue(fixture.session.messages(ROOM).isEmpty());
    assertEquals(0, fixture.metrics.count("chat.history.received"));
  }

  @Test
  void liveMessagesSurviveTimeout() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    fixture.transport.deliver(EventName.NEW_MESSAGE, SessionFixture.message("m1", ROOM, "owner-7", "live"));

    fixture.scheduler.advance(8_000L);

    RecordingChatListener.HistoryLoaded loaded = fixture.listener.historyLoaded.get(0);
    assertEquals(HistoryOutcome.TIMED_OUT, loaded.outcome());
    assertEquals(1, loaded.timeline().size());
  }

  @Test
  void leavingRoomCancelsPendingHistory() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    CompletableFuture<HistoryOutcome> outcome = fixture.session.historyOutcome(ROOM).orElseThrow();

    fixture.session.closeRoom(ROOM);

    assertEquals(HistoryOutcome.CANCELLED, outcome.getNow(null));
    assertFalse(fixture.session.isHistoryLoading(ROOM));
    fixture.scheduler.advance(8_000L);
    assertEquals(0, fixture.metrics.count("chat.history.timeout"));
  }

  @Test
  void snapshotForOtherRoomDoesNotSettleThisOne() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    RoomId other = RoomId.forRestaurant("r7");

    fixture.transport.deliver(EventName.MESSAGE_HISTORY, new HistorySnapshot(other, List.of()));

    assertTrue(fixture.session.isHistoryLoading(ROOM));
  }

  @Test
  void emptySnapshotSettlesHistoryAndDisarmsTimeout() {
    SessionFixture fixture = new SessionFixture().ready();
    fixture.session.joinRoom(ROOM);
    CompletableFuture<HistoryOutcome> outcome = fixture.session.historyOutcome(ROOM).orElseThrow();
    fixture.transport.deliver(EventName.JOINED_ROOM, new JoinAck(ROOM, true));

    fixture.scheduler.advance(200L);
    fixture.transport.deliver(EventName.MESSAGE_HISTORY, new HistorySnapshot(ROOM, List.of()));

    assertEquals(HistoryOutcome.RECEIVED, outcome.getNow(null));
    assertFalse(fixture.session.isHistoryLoading(ROOM));
    assertTrue(fixture.session.messages(ROOM).isEmpty());

    fixture.scheduler.advance(10_000L);

    assertEquals(0, fixture.metrics.count("chat.history.timeout"));
    assertEquals(List.of(ROOM.value() + "=true", ROOM.value() + "=false"), fixture.listener.historyLoading);
  }
}
