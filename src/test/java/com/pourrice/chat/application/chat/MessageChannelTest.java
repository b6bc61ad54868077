package com.pourrice.chat.application.chat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pourrice.chat.domain.chat.ChatMessage;
import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.protocol.EventName;
import com.pourrice.chat.domain.protocol.PrivateMessage;
import java.util.List;
import org.junit.jupiter.api.Test;

class MessageChannelTest {
  private static final RoomId ROOM = SessionFixture.ROOM;

  @Test
  void incomingMessagesAppendAndCountUnread() {
    SessionFixture fixture = new SessionFixture().ready().joined();

    fixture.transport.deliver(EventName.NEW_MESSAGE, SessionFixture.message("m1", ROOM, "owner-7", "welcome"));
    fixture.transport.deliver(EventName.NEW_MESSAGE, SessionFixture.message("m2", ROOM, "owner-7", "menu is up"));

    assertEquals(List.of("m1", "m2"), ids(fixture.session.messages(ROOM)));
    assertEquals(2, fixture.session.unreadCount(ROOM));
    assertEquals(List.of(1, 2), fixture.listener.unreadCounts);
    assertEquals(2, fixture.metrics.count("chat.message.received"));
  }

  @Test
  void ownAndVisibleMessagesDoNotCountAsUnread() {
    SessionFixture fixture = new SessionFixture().ready().joined();

    fixture.transport.deliver(EventName.NEW_MESSAGE, SessionFixture.message("m1", ROOM, SessionFixture.SELF, "hi"));
    fixture.session.setRoomVisible(ROOM, true);
    fixture.transport.deliver(EventName.NEW_MESSAGE, SessionFixture.message("m2", ROOM, "owner-7", "hello"));

    assertEquals(0, fixture.session.unreadCount(ROOM));
  }

  @Test
  void showingRoomMarksItRead() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    fixture.transport.deliver(EventName.NEW_MESSAGE, SessionFixture.message("m1", ROOM, "owner-7", "hello"));

    fixture.session.setRoomVisible(ROOM, true);

    assertEquals(0, fixture.session.unreadCount(ROOM));
    assertEquals(1, fixture.session.messages(ROOM).size());
  }

  @Test
  void duplicateMessageIdsAreIgnored() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    ChatMessage message = SessionFixture.message("m1", ROOM, "owner-7", "hello");

    fixture.transport.deliver(EventName.NEW_MESSAGE, message);
    fixture.transport.deliver(EventName.NEW_MESSAGE, message);

    assertEquals(1, fixture.session.messages(ROOM).size());
    assertEquals(1, fixture.listener.messages.size());
    assertEquals(1, fixture.metrics.count("chat.message.duplicate"));
  }

  @Test
  void messagesForRoomsNotJoinedAreDropped() {
    SessionFixture fixture = new SessionFixture().ready().joined();
    RoomId elsewhere = RoomId.forRestaurant("r99");

    fixture.transport.deliver(EventName.NEW_MESSAGE, SessionFixture.message("m1", elsewhere, "owner-7", "psst"));

    assertTrue(fixture.session.messages(elsewhere).isEmpty());
    assertTrue(fixture.listener.messages.isEmpty());
    assertEquals(1, fixture.metrics.count("chat.message.dropped"));
  }

  @Test
  void privateMessagesLandInPeerRoom() {
    SessionFixture fixture = new SessionFixture().ready();

    fixture.transport.deliver(
        EventName.PRIVATE_MESSAGE, new PrivateMessage("owner-7", "Owner", "your table is ready", "t1", "p1"));

    List<ChatMessage> timeline = fixture.session.messages(RoomId.forPrivatePeer("owner-7"));
    assertEquals(1, timeline.size());
    assertEquals("your table is ready", timeline.get(0).body());
    assertEquals("Owner", timeline.get(0).displayName());
  }

  @Test
  void mismatchedPayloadIsDroppedWithoutFailingTheSession() {
    SessionFixture fixture = new SessionFixture().ready().joined();

    fixture.transport.deliver(EventName.NEW_MESSAGE, "not a message");
    fixture.transport.deliver(EventName.NEW_MESSAGE, SessionFixture.message("m1", ROOM, "owner-7", "still here"));

    assertEquals(1, fixture.session.messages(ROOM).size());
  }

  private static List<String> ids(List<ChatMessage> messages) {
    return messages.stream().map(ChatMessage::messageId).toList();
  }
}
