package com.pourrice.chat.api;

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
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Prints chat events to the console through {@link CliPrinter}. Called on the session's event loop.
 */
final class ConsoleChatRenderer implements ChatEventListener {
  private final String selfUserId;
  private int lastUploadProgress = -1;

  ConsoleChatRenderer(String selfUserId) {
    this.selfUserId = Objects.requireNonNull(selfUserId, "selfUserId");
  }

  @Override
  public void onConnectionStateChanged(ConnectionState state) {
    if (state == ConnectionState.DISCONNECTED) {
      CliPrinter.println("* disconnected");
    }
  }

  @Override
  public void onSessionStateChanged(SessionState state) {
    if (state == SessionState.READY) {
      CliPrinter.println("* connected");
    } else if (state == SessionState.CONNECTING) {
      CliPrinter.println("* connecting...");
    }
  }

  @Override
  public void onMessage(ChatMessage message, int unreadCount) {
    CliPrinter.println(format(message));
  }

  @Override
  public void onHistoryLoading(RoomId roomId, boolean loading) {
    if (loading) {
      CliPrinter.println("* loading history of " + roomId + "...");
    }
  }

  @Override
  public void onHistoryLoaded(RoomId roomId, HistoryOutcome outcome, List<ChatMessage> timeline) {
    switch (outcome) {
      case RECEIVED -> {
        String[] lines = new String[timeline.size() + 1];
        lines[0] = "* " + timeline.size() + " message(s) in " + roomId;
        for (int i = 0; i < timeline.size(); i++) {
          lines[i + 1] = format(timeline.get(i));
        }
        CliPrinter.printLines(lines);
      }
      case TIMED_OUT -> CliPrinter.println("* history of " + roomId + " is unavailable");
      case CANCELLED -> {
        // Room closed before history arrived.
      }
    }
  }

  @Override
  public void onTypingChanged(TypingIndicator indicator, List<String> typingUsers) {
    if (!typingUsers.isEmpty()) {
      CliPrinter.println("* " + String.join(", ", typingUsers) + (typingUsers.size() == 1 ? " is" : " are")
          + " typing...");
    }
  }

  @Override
  public void onPresence(PresenceEvent event) {
    CliPrinter.println("* " + name(event.displayName(), event.userId()) + (event.online() ? " is online" : " went offline"));
  }

  @Override
  public void onRoomMembership(RoomMembershipEvent event) {
    if (!event.userId().equals(selfUserId)) {
      CliPrinter.println("* " + event.userId() + (event.joined() ? " joined " : " left ") + event.roomId());
    }
  }

  @Override
  public void onAttachmentChanged(Optional<PendingAttachment> attachment) {
    if (attachment.isEmpty()) {
      lastUploadProgress = -1;
      return;
    }
    PendingAttachment pending = attachment.get();
    if (pending.uploadedImage().isPresent()) {
      CliPrinter.println("* image " + pending.fileName() + " ready; it will be sent with your next message");
    } else if (pending.uploadProgress() / 25 != lastUploadProgress / 25) {
      CliPrinter.println("* uploading " + pending.fileName() + " " + pending.uploadProgress() + "%");
    }
    lastUploadProgress = pending.uploadProgress();
  }

  @Override
  public void onError(ChatException error) {
    CliPrinter.println("! " + error.userMessage());
  }

  String format(ChatMessage message) {
    String author = message.isFrom(selfUserId) ? "you" : name(message.displayName(), message.userId());
    String content = message.body();
    if (message.image().isPresent()) {
      String image = "<image " + message.image().get() + ">";
      content = content.isEmpty() ? image : content + " " + image;
    }
    return "[" + message.roomId() + "] " + author + ": " + content;
  }

  private static String name(String displayName, String userId) {
    return displayName == null || displayName.isBlank() ? userId : displayName;
  }
}
