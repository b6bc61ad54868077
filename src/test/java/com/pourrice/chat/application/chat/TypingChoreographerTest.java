package com.pourrice.chat.application.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.chat.TypingIndicator;
import com.pourrice.chat.domain.protocol.EventName;
import com.pourrice.chat.domain.protocol.OutboundEvent;
import com.pourrice.chat.domain.protocol.SendMessageRequest;
import com.pourrice.chat.domain.protocol.TypingSignal;
import java.util.List;
import org.junit.jupiter.api.Test;

class TypingChoreographerTest {
  private static final RoomId ROOM = SessionFixture.ROOM;

  @Test
  void keystrokesOpenOneWindowThatClosesAfterIdle() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    fixture.transport.clearSent();

    fixture.session.typing(ROOM);
    fixture.scheduler.advance(1_500L);
    fixture.session.typing(ROOM);
    fixture.scheduler.advance(1_999L);

    assertEquals(List.of(signal(true)), fixture.transport.sent(TypingSignal.class));

    fixture.scheduler.advance(1L);

    assertEquals(List.of(signal(true), signal(false)), fixture.transport.sent(TypingSignal.class));
  }

  @Test
  void sendingClosesTypingWindowFirst() throws Exception {
    SessionFixture fixture = new SessionFixture().ready().joined();
    fixture.transport.clearSent();

    fixture.session.typing(ROOM);
    fixture.session.send(ROOM, "done typing").get();

    List<OutboundEvent> sent = fixture.transport.sent();
    assertEquals(3, sent.size());
    assertEquals(signal(true), sent.get(0));
    assertEquals(signal(false), sent.get(1));
    assertInstanceOf(SendMessageRequest.class, sent.get(2));
    fixture.scheduler.advance(5_000L);
    assertEquals(2, fixture.transport.sent(TypingSignal.class).size());
  }

  @Test
  void typingWhileDisconnectedSendsNothing() {
    SessionFixture fixture = new SessionFixture();

    fixture.session.typing(ROOM);

    assertTrue(fixture.transport.sent().isEmpty());
    assertEquals(0, fixture.scheduler.pendingTimers());
  }

  @Test
  void remoteTypersExpireWithoutStopSignal() {
    SessionFixture fixture = new SessionFixture().ready().joined();

    fixture.transport.deliver(EventName.USER_TYPING, new TypingIndicator(ROOM, "owner-7", "Owner", true));
    fixture.scheduler.advance(1_000L);
    fixture.transport.deliver(EventName.USER_TYPING, new TypingIndicator(ROOM, "diner-9", "Sam", true));

    assertEquals(List.of("Owner", "Sam"), fixture.session.typingUsers(ROOM));

    fixture.scheduler.advance(2_000L);
    assertEquals(List.of("Sam"), fixture.session.typingUsers(ROOM));

    fixture.scheduler.advance(1_000L);
    assertTrue(fixture.session.typingUsers(ROOM).isEmpty());
  }

  @Test
  void repeatedIndicatorExtendsExpiry() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    TypingIndicator typing = new TypingIndicator(ROOM, "owner-7", "Owner", true);

    fixture.transport.deliver(EventName.USER_TYPING, typing);
    fixture.scheduler.advance(2_500L);
    fixture.transport.deliver(EventName.USER_TYPING, typing);
    fixture.scheduler.advance(2_500L);

    assertEquals(List.of("Owner"), fixture.session.typingUsers(ROOM));
    assertEquals(1, fixture.listener.typingSnapshots.size());
  }

  @Test
  void stopIndicatorRemovesTyper() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    fixture.transport.deliver(EventName.USER_TYPING, new TypingIndicator(ROOM, "owner-7", "Owner", true));

    fixture.transport.deliver(EventName.USER_TYPING, new TypingIndicator(ROOM, "owner-7", "Owner", false));

    assertTrue(fixture.session.typingUsers(ROOM).isEmpty());
    assertEquals(List.of(List.of("Owner"), List.of()), fixture.listener.typingSnapshots);
  }

  @Test
  void ownIndicatorIsIgnored() {
    SessionFixture fixture = new SessionFixture().ready().joined();

    fixture.transport.deliver(EventName.USER_TYPING, new TypingIndicator(ROOM, SessionFixture.SELF, "Dana", true));

    assertTrue(fixture.session.typingUsers(ROOM).isEmpty());
    assertTrue(fixture.listener.typingSnapshots.isEmpty());
  }

  @Test
  void connectionLossClearsTypers() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    fixture.transport.deliver(EventName.USER_TYPING, new TypingIndicator(ROOM, "owner-7", "Owner", true));

    fixture.transport.simulateClose("1006 abnormal");

    assertTrue(fixture.session.typingUsers(ROOM).isEmpty());
  }

  private static TypingSignal signal(boolean typing) {
    return new TypingSignal(ROOM, SessionFixture.SELF, "Dana", typing);
  }

  @Test
  void indicatorForRoomNotJoinedIsIgnored() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    RoomId other = RoomId.forRestaurant("999");

    fixture.transport.deliver(EventName.USER_TYPING, new TypingIndicator(other, "owner-7", "Owner", true));

    assertTrue(fixture.session.typingUsers(other).isEmpty());
    assertTrue(fixture.listener.typingSnapshots.isEmpty());
  }
}
