package com.pourrice.chat.application.chat;

import com.pourrice.chat.application.port.ChatEventListener;
import com.pourrice.chat.application.port.IdentityProvider;
import com.pourrice.chat.application.port.ImageStorePort;
import com.pourrice.chat.application.port.MetricsPort;
import com.pourrice.chat.application.port.SchedulerPort;
import com.pourrice.chat.application.port.TokenProvider;
import com.pourrice.chat.application.port.TransportPort;
import com.pourrice.chat.application.util.ObservableValue;
import com.pourrice.chat.application.util.StateCell;
import com.pourrice.chat.domain.chat.ChatMessage;
import com.pourrice.chat.domain.chat.ConnectionState;
import com.pourrice.chat.domain.chat.HistoryOutcome;
import com.pourrice.chat.domain.chat.HistorySnapshot;
import com.pourrice.chat.domain.chat.ImageFile;
import com.pourrice.chat.domain.chat.PendingAttachment;
import com.pourrice.chat.domain.chat.PresenceEvent;
import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.chat.RoomMembershipEvent;
import com.pourrice.chat.domain.chat.SessionState;
import com.pourrice.chat.domain.chat.TypingIndicator;
import com.pourrice.chat.domain.chat.UploadedImage;
import com.pourrice.chat.domain.error.NotConnectedException;
import com.pourrice.chat.domain.error.NotRegisteredException;
import com.pourrice.chat.domain.protocol.InboundEvent;
import com.pourrice.chat.domain.protocol.JoinAck;
import com.pourrice.chat.domain.protocol.PrivateMessage;
import com.pourrice.chat.domain.protocol.RegistrationAck;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One user's chat session over one connection: the entry point for UI layers.
 * <p><strong>Why:</strong> Bundles connection, registration, rooms, messages, history, typing and attachments behind
 * an explicit lifecycle ({@link #open()} / {@link #close()}) with injected collaborators, instead of process-wide
 * mutable state.</p>
 * <p><strong>Pipeline:</strong> {@link SessionState} is derived from connection and registration state. Room
 * intents recorded earlier are sent exactly when the session becomes {@link SessionState#READY}.</p>
 * <p><strong>Thread-safety:</strong> Public methods may be called from any thread. Arguments are validated on the
 * caller's thread; the work itself hops onto the scheduler's event loop, where all state lives. Listener callbacks
 * run on that loop.</p>
 * <p><strong>Errors:</strong> Asynchronous failures complete the returned futures exceptionally with
 * {@code ChatException} subtypes; caller mistakes throw {@link IllegalArgumentException} or
 * {@link NullPointerException} immediately.</p>
 *
 * @since 0.1.0
 */
public final class ChatSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ChatSession.class);

  private final SchedulerPort scheduler;
  private final ChatEventListener listener;
  private final ConnectionManager connection;
  private final RegistrationCoordinator registration;
  private final TypingChoreographer typing;
  private final MessageChannel channel;
  private final HistoryReconciler history;
  private final AttachmentStager attachments;
  private final RoomSessionManager rooms;
  private final StateCell<SessionState> sessionState = new StateCell<>("session", SessionState.IDLE);

  /**
   * Creates a session. Nothing happens until {@link #open()} or a room is opened.
   *
   * @param transport chat connection
   * @param scheduler single-threaded event loop owning all session state
   * @param tokens bearer token source, called per request
   * @param identity local user source
   * @param imageStore attachment storage
   * @param listener UI callbacks; {@code null} for none
   * @param metrics metrics sink; {@code null} for none
   * @param settings tunables
   */
  public ChatSession(
      TransportPort transport,
      SchedulerPort scheduler,
      TokenProvider tokens,
      IdentityProvider identity,
      ImageStorePort imageStore,
      ChatEventListener listener,
      MetricsPort metrics,
      ChatSettings settings) {
    Objects.requireNonNull(settings, "settings");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.listener = listener == null ? ChatEventListener.NO_OP : listener;
    MetricsPort sink = metrics == null ? MetricsPort.NO_OP : metrics;
    this.connection = new ConnectionManager(
        transport, scheduler, identity, settings.socketUri(), settings.reconnect(), sink);
    AuthorizedEmitter emitter = new AuthorizedEmitter(connection, tokens, scheduler);
    this.registration = new RegistrationCoordinator(connection, emitter, identity, this.listener, sink);
    this.typing = new TypingChoreographer(
        connection,
        scheduler,
        identity,
        this.listener,
        this::isTracking,
        settings.typingIdleMillis(),
        settings.typingExpiryMillis());
    this.channel = new MessageChannel(connection, emitter, identity, this::isTracking, this.listener, sink);
    this.history = new HistoryReconciler(scheduler, channel, this.listener, sink, settings.historyTimeoutMillis());
    this.attachments = new AttachmentStager(imageStore, scheduler, this.listener, sink, settings.attachmentMaxBytes());
    this.rooms = new RoomSessionManager(
        connection,
        emitter,
        identity,
        new RoomSessionManager.RoomLifecycle() {
          @Override
          public void joinRequested(RoomId roomId) {
            history.arm(roomId);
          }

          @Override
          public void released(RoomId roomId) {
            history.cancel(roomId);
            typing.clearRoom(roomId);
          }
        },
        () -> sessionState.get() == SessionState.READY,
        this.listener,
        sink);

    registration.onRejected(() -> rooms.failQueued(
        new NotRegisteredException("Chat server refused registration")));
    connection.onInbound(this::route);
    connection.state().subscribe(state -> {
      this.listener.onConnectionStateChanged(state);
      updateSessionState();
    });
    registration.registered().subscribe(registered -> {
      this.listener.onRegistrationChanged(registered);
      updateSessionState();
    });
    rooms.activeRooms().subscribe(this.listener::onActiveRoomsChanged);
  }

  /**
   * Opens the connection.
   *
   * @return future completed once connected
   */
  public CompletableFuture<Void> open() {
    return onLoop(connection::connect);
  }

  /**
   * Opens the chat of a restaurant: connects if needed and joins {@code restaurant-<id>}. History loading starts
   * when the join request is sent.
   *
   * @param restaurantId restaurant identifier
   * @return future completed with {@code true} once joined
   */
  public CompletableFuture<Boolean> openRoom(String restaurantId) {
    return joinRoom(RoomId.forRestaurant(restaurantId));
  }

  /**
   * Joins a room. Idempotent per room.
   *
   * @param roomId room to join
   * @return future completed with {@code true} once joined, {@code false} when rejected or abandoned; fails with
   *     {@code NotRegisteredException} when the server refused registration on this connection
   */
  public CompletableFuture<Boolean> joinRoom(RoomId roomId) {
    Objects.requireNonNull(roomId, "roomId");
    return onLoop(() -> {
      if (registration.isRejected()) {
        return CompletableFuture.failedFuture(new NotRegisteredException("Chat server refused registration"));
      }
      return rooms.joinRoom(roomId);
    });
  }

  /**
   * Leaves a room, abandoning its history wait and typing state. The timeline is kept.
   *
   * @param roomId room to leave
   * @return future completed once the leave was processed
   */
  public CompletableFuture<Void> closeRoom(RoomId roomId) {
    Objects.requireNonNull(roomId, "roomId");
    return onLoop(() -> {
      channel.setVisible(roomId, false);
      return rooms.leaveRoom(roomId);
    });
  }

  /**
   * Sends a message, attaching the staged image if its upload completed.
   *
   * @param roomId target room
   * @param body text; may be blank only when an uploaded image is staged
   * @return future completed once the transport accepted the message; when it fails, an attached image is staged
   *     again
   * @throws IllegalArgumentException when the body is blank and no uploaded image is staged
   */
  public CompletableFuture<Void> send(RoomId roomId, String body) {
    Objects.requireNonNull(roomId, "roomId");
    Objects.requireNonNull(body, "body");
    if (body.isBlank() && !attachments.hasUploadedImage()) {
      throw new IllegalArgumentException("message must have text or an image");
    }
    return onLoop(() -> {
      if (body.isBlank() && !attachments.hasUploadedImage()) {
        throw new IllegalArgumentException("message must have text or an image");
      }
      if (!connection.isConnected()) {
        return CompletableFuture.failedFuture(new NotConnectedException("Chat is not connected"));
      }
      Optional<UploadedImage> image = attachments.consumeForSend();
      typing.stopTyping(roomId);
      CompletableFuture<Void> sent;
      try {
        sent = channel.sendMessage(roomId, body, image.map(UploadedImage::url).orElse(null));
      } catch (RuntimeException ex) {
        sent = CompletableFuture.failedFuture(ex);
      }
      if (image.isEmpty()) {
        return sent;
      }
      UploadedImage attached = image.get();
      return sent.whenCompleteAsync((ignored, error) -> {
        if (error == null) {
          attachments.confirmSent(attached);
        } else {
          attachments.returnUnsent(attached);
        }
      }, scheduler);
    });
  }

  /**
   * Sends a direct message. Replies arrive in room {@code private-<userId>}.
   *
   * @param toUserId recipient
   * @param body text; must not be blank
   * @return future completed once the transport accepted the message
   */
  public CompletableFuture<Void> sendPrivate(String toUserId, String body) {
    Objects.requireNonNull(toUserId, "toUserId");
    MessageChannel.requireContent(body, null);
    return onLoop(() -> channel.sendPrivateMessage(toUserId, body));
  }

  /**
   * Records a local keystroke in a room.
   *
   * @param roomId room being typed in
   */
  public void typing(RoomId roomId) {
    Objects.requireNonNull(roomId, "roomId");
    scheduler.execute(() -> typing.notifyTyping(roomId));
  }

  /**
   * Stages an image for the next message and starts uploading it.
   *
   * @param file image file
   * @return future completed once uploaded
   * @throws IllegalArgumentException when the file is not an image or too large
   */
  public CompletableFuture<UploadedImage> selectImage(ImageFile file) {
    attachments.validate(file);
    return onLoop(() -> attachments.selectImage(file));
  }

  /**
   * Discards the staged image and deletes its uploaded object.
   *
   * @return future completed once processed
   */
  public CompletableFuture<Void> clearImage() {
    return onLoop(attachments::clearImage);
  }

  /**
   * Marks whether a room's chat view is on screen. Visible rooms accumulate no unread messages.
   *
   * @param roomId room
   * @param shown whether the view is visible
   */
  public void setRoomVisible(RoomId roomId, boolean shown) {
    Objects.requireNonNull(roomId, "roomId");
    scheduler.execute(() -> channel.setVisible(roomId, shown));
  }

  /**
   * Resets a room's unread count.
   *
   * @param roomId room
   */
  public void markRead(RoomId roomId) {
    Objects.requireNonNull(roomId, "roomId");
    scheduler.execute(() -> channel.markRead(roomId));
  }

  /**
   * Ends the session: leaves every room, abandons history waits, discards the staged image and disconnects.
   *
   * @return future completed once disconnected
   */
  public CompletableFuture<Void> shutdown() {
    return onLoop(() -> {
      List<CompletableFuture<Void>> leaves = new ArrayList<>();
      for (RoomId roomId : rooms.trackedRooms()) {
        leaves.add(rooms.leaveRoom(roomId).exceptionally(error -> {
          log.debug("Leave of {} not sent on close: {}", roomId, error.getMessage());
          return null;
        }));
      }
      return CompletableFuture.allOf(leaves.toArray(new CompletableFuture<?>[0]))
          .thenComposeAsync(ignored -> {
            history.cancelAll();
            typing.clearAll();
            CompletableFuture<Void> discard = attachments.discardOnClose();
            connection.disconnect();
            log.info("Chat session closed");
            return discard;
          }, scheduler);
    });
  }

  /**
   * Same as {@link #shutdown()} without waiting for completion.
   */
  @Override
  public void close() {
    shutdown();
  }

  /**
   * Returns the derived pipeline state.
   *
   * @return observable session state
   */
  public ObservableValue<SessionState> sessionState() {
    return sessionState;
  }

  public ObservableValue<ConnectionState> connectionState() {
    return connection.state();
  }

  public ObservableValue<Boolean> registered() {
    return registration.registered();
  }

  public ObservableValue<Set<RoomId>> activeRooms() {
    return rooms.activeRooms();
  }

  public List<ChatMessage> messages(RoomId roomId) {
    return channel.messages(roomId);
  }

  public int unreadCount(RoomId roomId) {
    return channel.unreadCount(roomId);
  }

  public boolean isHistoryLoading(RoomId roomId) {
    return history.isLoading(roomId);
  }

  /**
   * Returns the outcome of a room's pending history wait.
   *
   * @param roomId room
   * @return pending outcome, or empty when the room is not loading
   */
  public Optional<CompletableFuture<HistoryOutcome>> historyOutcome(RoomId roomId) {
    return history.pendingOutcome(roomId);
  }

  public List<String> typingUsers(RoomId roomId) {
    return typing.typingUsers(roomId);
  }

  public boolean isUserOnline(String userId) {
    return registration.isUserOnline(userId);
  }

  public Set<String> onlineUsers() {
    return registration.onlineUsers();
  }

  public Optional<PendingAttachment> attachment() {
    return attachments.current();
  }

  private boolean isTracking(RoomId roomId) {
    return rooms.isTracking(roomId);
  }

  private void updateSessionState() {
    SessionState next = SessionState.derive(connection.state().get(), registration.registered().get());
    if (!sessionState.set(next)) {
      return;
    }
    log.info("Chat session {}", next);
    listener.onSessionStateChanged(next);
    if (next == SessionState.READY) {
      rooms.flushQueued();
    }
  }

  private void route(InboundEvent event) {
    try {
      switch (event.name()) {
        case REGISTERED -> registration.onRegistered(event.payloadAs(RegistrationAck.class));
        case JOINED_ROOM -> rooms.onJoinAck(event.payloadAs(JoinAck.class));
        case NEW_MESSAGE -> channel.onNewMessage(event.payloadAs(ChatMessage.class));
        case PRIVATE_MESSAGE -> channel.onPrivateMessage(event.payloadAs(PrivateMessage.class));
        case MESSAGE_HISTORY -> history.onSnapshot(event.payloadAs(HistorySnapshot.class));
        case USER_TYPING -> typing.onUserTyping(event.payloadAs(TypingIndicator.class));
        case USER_ONLINE, USER_OFFLINE -> registration.onPresence(event.payloadAs(PresenceEvent.class));
        case USER_JOINED_ROOM, USER_LEFT_ROOM -> rooms.onMembership(event.payloadAs(RoomMembershipEvent.class));
        default -> log.debug("Ignoring unexpected inbound event {}", event.name().wireName());
      }
    } catch (IllegalStateException ex) {
      log.warn("Dropping inbound {}: {}", event.name().wireName(), ex.getMessage());
    }
  }

  private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> work) {
    CompletableFuture<T> result = new CompletableFuture<>();
    scheduler.execute(() -> {
      try {
        work.get().whenComplete((value, error) -> {
          if (error != null) {
            result.completeExceptionally(
                error instanceof CompletionException && error.getCause() != null ? error.getCause() : error);
          } else {
            result.complete(value);
          }
        });
      } catch (RuntimeException ex) {
        result.completeExceptionally(ex);
      }
    });
    return result;
  }
}
