package com.pourrice.chat.application.chat;

import com.pourrice.chat.application.port.ChatEventListener;
import com.pourrice.chat.application.port.IdentityProvider;
import com.pourrice.chat.application.port.MetricsPort;
import com.pourrice.chat.domain.chat.ChatMessage;
import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.chat.UserIdentity;
import com.pourrice.chat.domain.error.NotAuthenticatedException;
import com.pourrice.chat.domain.error.NotConnectedException;
import com.pourrice.chat.domain.protocol.PrivateMessage;
import com.pourrice.chat.domain.protocol.PrivateMessageRequest;
import com.pourrice.chat.domain.protocol.SendMessageRequest;
import com.pourrice.chat.logging.Logs;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Sends chat messages and maintains the per-room timelines.
 * <p><strong>Delivery:</strong> Sends are not rendered optimistically. A message appears in a timeline only when the
 * server delivers it as {@code new-message}, a history snapshot or a private message. Each {@code messageId} is
 * kept once per room, in first-arrival order.</p>
 * <p><strong>Unread counts:</strong> Incoming messages from other users increment a room's unread count while the
 * room is not marked visible.</p>
 * <p><strong>Thread-safety:</strong> Mutations are confined to the event loop; read accessors may be called from any
 * thread.</p>
 * <p><strong>Observability:</strong> Emits {@code chat.message.received}, {@code chat.message.duplicate},
 * {@code chat.message.dropped} and {@code chat.message.sent}.</p>
 *
 * @since 0.1.0
 */
public final class MessageChannel {
  private static final Logger log = LoggerFactory.getLogger(MessageChannel.class);
  private static final int LOG_BODY_BYTES = 64;

  private final ConnectionManager connection;
  private final AuthorizedEmitter emitter;
  private final IdentityProvider identity;
  private final Predicate<RoomId> acceptsRoom;
  private final ChatEventListener listener;
  private final MetricsPort metrics;
  private final Map<RoomId, RoomTimeline> timelines = new ConcurrentHashMap<>();
  private final Set<RoomId> visible = ConcurrentHashMap.newKeySet();

  MessageChannel(
      ConnectionManager connection,
      AuthorizedEmitter emitter,
      IdentityProvider identity,
      Predicate<RoomId> acceptsRoom,
      ChatEventListener listener,
      MetricsPort metrics) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.emitter = Objects.requireNonNull(emitter, "emitter");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.acceptsRoom = Objects.requireNonNull(acceptsRoom, "acceptsRoom");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Validates message content.
   *
   * @param body text body; must not be {@code null}
   * @param imageUrl optional image reference
   * @throws IllegalArgumentException when the body is blank and no image is attached
   */
  static void requireContent(String body, String imageUrl) {
    Objects.requireNonNull(body, "body");
    if (body.isBlank() && (imageUrl == null || imageUrl.isBlank())) {
      throw new IllegalArgumentException("message must have text or an image");
    }
  }

  /**
   * Sends a message to a room.
   *
   * @param roomId target room
   * @param body text body; may be blank when {@code imageUrl} is set
   * @param imageUrl optional uploaded image reference
   * @return future completed once the transport accepted the message; failed with {@link NotConnectedException}
   *     while disconnected
   * @throws IllegalArgumentException when neither text nor image is present
   */
  CompletableFuture<Void> sendMessage(RoomId roomId, String body, String imageUrl) {
    Objects.requireNonNull(roomId, "roomId");
    requireContent(body, imageUrl);
    if (!connection.isConnected()) {
      return CompletableFuture.failedFuture(new NotConnectedException("Chat is not connected"));
    }
    Optional<UserIdentity> user = identity.currentUser();
    if (user.isEmpty()) {
      return CompletableFuture.failedFuture(new NotAuthenticatedException("No local user identity"));
    }
    UserIdentity self = user.get();
    String text = body.trim();
    return emitter.emit(token -> new SendMessageRequest(
            roomId, self.userId(), self.effectiveDisplayName(), text, imageUrl, token))
        .thenRun(() -> {
          metrics.increment("chat.message.sent");
          log.debug("Sent message to {}: {}", roomId, Logs.truncate(text, LOG_BODY_BYTES));
        });
  }

  /**
   * Sends a direct message to one user.
   *
   * @param toUserId recipient
   * @param body text body; must not be blank
   * @return future completed once the transport accepted the message
   */
  CompletableFuture<Void> sendPrivateMessage(String toUserId, String body) {
    Objects.requireNonNull(toUserId, "toUserId");
    requireContent(body, null);
    if (!connection.isConnected()) {
      return CompletableFuture.failedFuture(new NotConnectedException("Chat is not connected"));
    }
    Optional<UserIdentity> user = identity.currentUser();
    if (user.isEmpty()) {
      return CompletableFuture.failedFuture(new NotAuthenticatedException("No local user identity"));
    }
    UserIdentity self = user.get();
    boolean sent = connection.send(
        new PrivateMessageRequest(toUserId, self.userId(), self.effectiveDisplayName(), body.trim()));
    if (!sent) {
      return CompletableFuture.failedFuture(new NotConnectedException("Chat is not connected"));
    }
    metrics.increment("chat.message.sent");
    return CompletableFuture.completedFuture(null);
  }

  void onNewMessage(ChatMessage message) {
    if (!acceptsRoom.test(message.roomId())) {
      metrics.increment("chat.message.dropped");
      log.debug("Dropping message {} for room {} that is not joined", message.messageId(), message.roomId());
      return;
    }
    append(message);
  }

  void onPrivateMessage(PrivateMessage message) {
    append(message.toChatMessage());
  }

  /**
   * Replaces a room's timeline with history contents.
   *
   * @param roomId room
   * @param messages snapshot contents in server order
   * @return timeline after replacement
   */
  List<ChatMessage> replaceTimeline(RoomId roomId, List<ChatMessage> messages) {
    return timeline(roomId).replace(messages);
  }

  /**
   * Returns a room's messages.
   *
   * @param roomId room
   * @return immutable snapshot in arrival order; empty for unknown rooms
   */
  public List<ChatMessage> messages(RoomId roomId) {
    RoomTimeline timeline = timelines.get(roomId);
    return timeline == null ? List.of() : timeline.snapshot();
  }

  /**
   * Returns the number of unread messages of a room.
   *
   * @param roomId room
   * @return unread count
   */
  public int unreadCount(RoomId roomId) {
    RoomTimeline timeline = timelines.get(roomId);
    return timeline == null ? 0 : timeline.unreadCount();
  }

  void markRead(RoomId roomId) {
    RoomTimeline timeline = timelines.get(roomId);
    if (timeline != null) {
      timeline.markRead();
    }
  }

  void setVisible(RoomId roomId, boolean shown) {
    if (shown) {
      visible.add(roomId);
      markRead(roomId);
    } else {
      visible.remove(roomId);
    }
  }

  private void append(ChatMessage message) {
    RoomTimeline timeline = timeline(message.roomId());
    if (!timeline.append(message)) {
      metrics.increment("chat.message.duplicate");
      log.debug("Ignoring duplicate message {} in {}", message.messageId(), message.roomId());
      return;
    }
    metrics.increment("chat.message.received");
    String self = identity.currentUser().map(UserIdentity::userId).orElse(null);
    int unread = timeline.unreadCount();
    if (!message.isFrom(self) && !visible.contains(message.roomId())) {
      unread = timeline.incrementUnread();
    }
    listener.onMessage(message, unread);
  }

  private RoomTimeline timeline(RoomId roomId) {
    return timelines.computeIfAbsent(roomId, RoomTimeline::new);
  }
}
