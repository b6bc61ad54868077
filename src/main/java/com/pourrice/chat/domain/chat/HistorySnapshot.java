package com.pourrice.chat.domain.chat;

import java.util.List;
import java.util.Objects;

/**
 * One-time history reply delivered after a room join. May legitimately be empty.
 *
 * @param roomId room the history belongs to
 * @param messages messages in server order
 * @since 0.1.0
 */
public record HistorySnapshot(RoomId roomId, List<ChatMessage> messages) {

  public HistorySnapshot {
    Objects.requireNonNull(roomId, "roomId");
    messages = messages == null ? List.of() : List.copyOf(messages);
  }
}
