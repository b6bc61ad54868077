package com.pourrice.chat.application.chat;

import com.pourrice.chat.domain.chat.ChatMessage;
import com.pourrice.chat.domain.chat.RoomId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, de-duplicated message list of one room.
 *
 * <p>Messages are kept in arrival order and each {@code messageId} appears at most once. Mutations happen on the
 * event loop; {@link #snapshot()} and {@link #unreadCount()} may be read from any thread.</p>
 *
 * @since 0.1.0
 */
final class RoomTimeline {
  private final RoomId roomId;
  private final Set<String> ids = new HashSet<>();
  private volatile List<ChatMessage> messages = List.of();
  private volatile int unread;

  RoomTimeline(RoomId roomId) {
    this.roomId = Objects.requireNonNull(roomId, "roomId");
  }

  /**
   * Appends a message unless its id is already present.
   *
   * @param message message to append
   * @return {@code true} when appended, {@code false} for a duplicate
   */
  boolean append(ChatMessage message) {
    if (!ids.add(message.messageId())) {
      return false;
    }
    List<ChatMessage> next = new ArrayList<>(messages.size() + 1);
    next.addAll(messages);
    next.add(message);
    messages = List.copyOf(next);
    return true;
  }

  /**
   * Replaces the whole timeline, keeping the first occurrence of each id in the given order.
   *
   * @param replacement new contents
   * @return resulting snapshot
   */
  List<ChatMessage> replace(List<ChatMessage> replacement) {
    ids.clear();
    List<ChatMessage> next = new ArrayList<>(replacement.size());
    for (ChatMessage message : replacement) {
      if (ids.add(message.messageId())) {
        next.add(message);
      }
    }
    messages = List.copyOf(next);
    return messages;
  }

  List<ChatMessage> snapshot() {
    return messages;
  }

  int incrementUnread() {
    unread = unread + 1;
    return unread;
  }

  int unreadCount() {
    return unread;
  }

  void markRead() {
    unread = 0;
  }

  @Override
  public String toString() {
    return "RoomTimeline[" + roomId + ", messages=" + messages.size() + ", unread=" + unread + "]";
  }
}
