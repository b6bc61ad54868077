package com.pourrice.chat.application.port;

import com.pourrice.chat.domain.chat.ChatMessage;
import com.pourrice.chat.domain.chat.ConnectionState;
import com.pourrice.chat.domain.chat.HistoryOutcome;
import com.pourrice.chat.domain.chat.PendingAttachment;
import com.pourrice.chat.domain.chat.PresenceEvent;
import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.chat.RoomMembershipEvent;
import com.pourrice.chat.domain.chat.SessionState;
import com.pourrice.chat.domain.chat.TypingIndicator;
import com.pourrice.chat.domain.error.ChatException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Outbound port through which the chat session publishes state to a UI layer.
 * <p><strong>Role:</strong> Implemented by presentation adapters such as {@code ConsoleChatRenderer}.</p>
 * <p><strong>Thread-safety:</strong> All callbacks are invoked on the session event loop, one at a time.
 * Implementations must not block.</p>
 *
 * @since 0.1.0
 */
public interface ChatEventListener {

  default void onConnectionStateChanged(ConnectionState state) {}

  default void onSessionStateChanged(SessionState state) {}

  default void onRegistrationChanged(boolean registered) {}

  default void onActiveRoomsChanged(Set<RoomId> rooms) {}

  /**
   * A new message was appended to a room timeline.
   *
   * @param message appended message
   * @param unreadCount unread messages in the room after appending
   */
  default void onMessage(ChatMessage message, int unreadCount) {}

  default void onHistoryLoading(RoomId roomId, boolean loading) {}

  /**
   * The history wait of a room ended.
   *
   * @param roomId room
   * @param outcome how the wait ended
   * @param timeline timeline after the outcome was applied
   */
  default void onHistoryLoaded(RoomId roomId, HistoryOutcome outcome, List<ChatMessage> timeline) {}

  /**
   * The set of users typing in a room changed.
   *
   * @param indicator change that caused the update
   * @param typingUsers display names of users typing now
   */
  default void onTypingChanged(TypingIndicator indicator, List<String> typingUsers) {}

  default void onPresence(PresenceEvent event) {}

  default void onRoomMembership(RoomMembershipEvent event) {}

  /**
   * The staged attachment changed.
   *
   * @param attachment current staging state; empty once cleared or consumed
   */
  default void onAttachmentChanged(Optional<PendingAttachment> attachment) {}

  /**
   * A user-facing failure occurred (upload, delete, send rejected).
   *
   * @param error failure to present
   */
  default void onError(ChatException error) {}

  /** Listener that ignores every callback. */
  ChatEventListener NO_OP = new ChatEventListener() {};
}
