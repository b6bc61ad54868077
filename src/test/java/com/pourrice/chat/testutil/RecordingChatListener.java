package com.pourrice.chat.testutil;

import com.pourrice.chat.application.port.ChatEventListener;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Listener that keeps every callback for later assertions. */
public final class RecordingChatListener implements ChatEventListener {
  public final List<ConnectionState> connectionStates = new ArrayList<>();
  public final List<SessionState> sessionStates = new ArrayList<>();
  public final List<Boolean> registrations = new ArrayList<>();
  public final List<ChatMessage> messages = new ArrayList<>();
  public final List<Integer> unreadCounts = new ArrayList<>();
  public final List<String> historyLoading = new ArrayList<>();
  public final List<HistoryLoaded> historyLoaded = new ArrayList<>();
  public final List<List<String>> typingSnapshots = new ArrayList<>();
  public final List<PresenceEvent> presence = new ArrayList<>();
  public final List<RoomMembershipEvent> memberships = new ArrayList<>();
  public final List<Optional<PendingAttachment>> attachments = new ArrayList<>();
  public final List<ChatException> errors = new ArrayList<>();

  @Override
  public void onConnectionStateChanged(ConnectionState state) {
    connectionStates.add(state);
  }

  @Override
  public void onSessionStateChanged(SessionState state) {
    sessionStates.add(state);
  }

  @Override
  public void onRegistrationChanged(boolean registered) {
    registrations.add(registered);
  }

  @Override
  public void onMessage(ChatMessage message, int unreadCount) {
    messages.add(message);
    unreadCounts.add(unreadCount);
  }

  @Override
  public void onHistoryLoading(RoomId roomId, boolean loading) {
    historyLoading.add(roomId.value() + "=" + loading);
  }

  @Override
  public void onHistoryLoaded(RoomId roomId, HistoryOutcome outcome, List<ChatMessage> timeline) {
    historyLoaded.add(new HistoryLoaded(roomId, outcome, timeline));
  }

  @Override
  public void onTypingChanged(TypingIndicator indicator, List<String> typingUsers) {
    typingSnapshots.add(typingUsers);
  }

  @Override
  public void onPresence(PresenceEvent event) {
    presence.add(event);
  }

  @Override
  public void onRoomMembership(RoomMembershipEvent event) {
    memberships.add(event);
  }

  @Override
  public void onAttachmentChanged(Optional<PendingAttachment> attachment) {
    attachments.add(attachment);
  }

  @Override
  public void onError(ChatException error) {
    errors.add(error);
  }

  public record HistoryLoaded(RoomId roomId, HistoryOutcome outcome, List<ChatMessage> timeline) {}
}
