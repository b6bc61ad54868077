package com.pourrice.chat.application.chat;

import com.pourrice.chat.application.port.ChatEventListener;
import com.pourrice.chat.application.port.IdentityProvider;
import com.pourrice.chat.application.port.MetricsPort;
import com.pourrice.chat.application.util.ObservableValue;
import com.pourrice.chat.application.util.StateCell;
import com.pourrice.chat.domain.chat.ConnectionState;
import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.chat.RoomMembershipEvent;
import com.pourrice.chat.domain.chat.UserIdentity;
import com.pourrice.chat.domain.error.NotAuthenticatedException;
import com.pourrice.chat.domain.protocol.JoinAck;
import com.pourrice.chat.domain.protocol.RoomRequest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Tracks which rooms the session wants, has requested and has joined.
 * <p><strong>Why:</strong> Join intents may be expressed at any time, but a {@code join-room} request must never
 * leave before registration is acknowledged. Intents are queued and flushed in order when the session pipeline
 * becomes ready.</p>
 * <p><strong>Room states:</strong> queued (intent recorded, nothing sent), awaiting acknowledgement (request sent)
 * and active (server confirmed). A connection loss moves active and awaiting rooms back to the queue; an explicit
 * disconnect or exhausted reconnection drops everything.</p>
 * <p><strong>Thread-safety:</strong> Confined to the event loop; {@link #activeRooms()} may be read anywhere.</p>
 *
 * @since 0.1.0
 */
public final class RoomSessionManager {
  private static final Logger log = LoggerFactory.getLogger(RoomSessionManager.class);

  /**
   * Callbacks fired when a room's server-side membership starts or stops.
   */
  interface RoomLifecycle {
    /**
     * A {@code join-room} request is about to be sent.
     *
     * @param roomId room being joined
     */
    void joinRequested(RoomId roomId);

    /**
     * The room was left, rejected or lost with the connection.
     *
     * @param roomId released room
     */
    void released(RoomId roomId);
  }

  private final ConnectionManager connection;
  private final AuthorizedEmitter emitter;
  private final IdentityProvider identity;
  private final RoomLifecycle lifecycle;
  private final BooleanSupplier ready;
  private final ChatEventListener listener;
  private final MetricsPort metrics;
  private final Map<RoomId, CompletableFuture<Boolean>> queued = new LinkedHashMap<>();
  private final Map<RoomId, CompletableFuture<Boolean>> awaitingAck = new LinkedHashMap<>();
  private final StateCell<Set<RoomId>> active = new StateCell<>("activeRooms", Set.of());
  private ConnectionState lastConnection = ConnectionState.DISCONNECTED;

  RoomSessionManager(
      ConnectionManager connection,
      AuthorizedEmitter emitter,
      IdentityProvider identity,
      RoomLifecycle lifecycle,
      BooleanSupplier ready,
      ChatEventListener listener,
      MetricsPort metrics) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.emitter = Objects.requireNonNull(emitter, "emitter");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
    this.ready = Objects.requireNonNull(ready, "ready");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    connection.state().subscribe(this::onConnectionState);
  }

  /**
   * Requests membership of a room. Idempotent per room.
   *
   * @param roomId room to join
   * @return future completed with {@code true} once joined, {@code false} when rejected or abandoned; fails with
   *     {@link NotAuthenticatedException} when no connection can be opened
   */
  CompletableFuture<Boolean> joinRoom(RoomId roomId) {
    Objects.requireNonNull(roomId, "roomId");
    if (active.get().contains(roomId)) {
      return CompletableFuture.completedFuture(Boolean.TRUE);
    }
    CompletableFuture<Boolean> pending = awaitingAck.get(roomId);
    if (pending == null) {
      pending = queued.get(roomId);
    }
    if (pending != null) {
      return pending;
    }
    CompletableFuture<Boolean> joined = new CompletableFuture<>();
    queued.put(roomId, joined);
    log.debug("Queued join of {}", roomId);
    if (ready.getAsBoolean()) {
      flushQueued();
    } else if (connection.state().get() == ConnectionState.DISCONNECTED) {
      connection.connect().whenComplete((ignored, error) -> {
        if (error != null && connection.state().get() == ConnectionState.DISCONNECTED) {
          failQueued(unwrap(error));
        }
      });
    }
    return joined;
  }

  /**
   * Sends every queued join in request order. Called when the session pipeline becomes ready.
   */
  void flushQueued() {
    if (queued.isEmpty()) {
      return;
    }
    Optional<UserIdentity> user = identity.currentUser();
    if (user.isEmpty()) {
      failQueued(new NotAuthenticatedException("No local user identity"));
      return;
    }
    String userId = user.get().userId();
    List<Map.Entry<RoomId, CompletableFuture<Boolean>>> batch = new ArrayList<>(queued.entrySet());
    queued.clear();
    for (Map.Entry<RoomId, CompletableFuture<Boolean>> entry : batch) {
      RoomId roomId = entry.getKey();
      CompletableFuture<Boolean> joined = entry.getValue();
      awaitingAck.put(roomId, joined);
      lifecycle.joinRequested(roomId);
      metrics.increment("chat.room.join");
      log.info("Joining {}", roomId);
      emitter.emitWhen(ready, token -> RoomRequest.join(roomId, userId, token))
          .whenComplete((ignored, error) -> {
            if (error != null) {
              onJoinNotSent(roomId, joined, unwrap(error));
            }
          });
    }
  }

  /**
   * Leaves a room, dropping any pending intent for it. Sends {@code leave-room} only while connected.
   *
   * @param roomId room to leave
   * @return future completed once the leave request was sent, or immediately when nothing is sent
   */
  CompletableFuture<Void> leaveRoom(RoomId roomId) {
    Objects.requireNonNull(roomId, "roomId");
    boolean wasActive = active.get().contains(roomId);
    if (wasActive) {
      Set<RoomId> remaining = new LinkedHashSet<>(active.get());
      remaining.remove(roomId);
      active.set(Collections.unmodifiableSet(remaining));
    }
    CompletableFuture<Boolean> pending = queued.remove(roomId);
    if (pending != null) {
      pending.complete(Boolean.FALSE);
    }
    CompletableFuture<Boolean> awaiting = awaitingAck.remove(roomId);
    if (awaiting != null) {
      awaiting.complete(Boolean.FALSE);
    }
    if (wasActive || awaiting != null) {
      lifecycle.released(roomId);
    }
    if (!connection.isConnected()) {
      return CompletableFuture.completedFuture(null);
    }
    Optional<UserIdentity> user = identity.currentUser();
    if (user.isEmpty()) {
      return CompletableFuture.completedFuture(null);
    }
    String userId = user.get().userId();
    log.info("Leaving {}", roomId);
    return emitter.emit(token -> RoomRequest.leave(roomId, userId, token));
  }

  void onJoinAck(JoinAck ack) {
    RoomId roomId = ack.roomId();
    CompletableFuture<Boolean> joined = awaitingAck.remove(roomId);
    if (joined == null) {
      log.debug("Ignoring join ack for {} without a pending join", roomId);
      return;
    }
    if (!ack.success()) {
      log.warn("Chat server rejected join of {}", roomId);
      lifecycle.released(roomId);
      joined.complete(Boolean.FALSE);
      return;
    }
    Set<RoomId> rooms = new LinkedHashSet<>(active.get());
    rooms.add(roomId);
    active.set(Collections.unmodifiableSet(rooms));
    log.info("Joined {}", roomId);
    joined.complete(Boolean.TRUE);
  }

  void onMembership(RoomMembershipEvent event) {
    if (!isTracking(event.roomId())) {
      log.debug("Ignoring membership change in untracked room {}", event.roomId());
      return;
    }
    listener.onRoomMembership(event);
  }

  /**
   * Returns the rooms the server confirmed.
   *
   * @return observable, immutable active-room set in join order
   */
  public ObservableValue<Set<RoomId>> activeRooms() {
    return active;
  }

  /**
   * Indicates whether the room is active or a join for it is pending.
   *
   * @param roomId room to check
   * @return {@code true} when messages for the room should be accepted
   */
  boolean isTracking(RoomId roomId) {
    return active.get().contains(roomId) || awaitingAck.containsKey(roomId) || queued.containsKey(roomId);
  }

  /**
   * Returns every room that is active or pending, in join order.
   *
   * @return snapshot of tracked rooms
   */
  List<RoomId> trackedRooms() {
    Set<RoomId> rooms = new LinkedHashSet<>(active.get());
    rooms.addAll(awaitingAck.keySet());
    rooms.addAll(queued.keySet());
    return List.copyOf(rooms);
  }

  private void onJoinNotSent(RoomId roomId, CompletableFuture<Boolean> joined, Throwable error) {
    if (awaitingAck.get(roomId) != joined) {
      return;
    }
    if (error instanceof NotAuthenticatedException) {
      log.warn("Join of {} not sent: {}", roomId, error.getMessage());
      awaitingAck.remove(roomId);
      lifecycle.released(roomId);
      joined.completeExceptionally(error);
      return;
    }
    // Connection dropped or registration reset; the state transition re-queues the room.
    log.debug("Join of {} deferred: {}", roomId, error.getMessage());
  }

  private void onConnectionState(ConnectionState state) {
    ConnectionState previous = lastConnection;
    lastConnection = state;
    if (state == ConnectionState.DISCONNECTED) {
      dropAll();
    } else if (previous == ConnectionState.CONNECTED) {
      requeueAll();
    }
  }

  private void requeueAll() {
    Map<RoomId, CompletableFuture<Boolean>> next = new LinkedHashMap<>();
    for (RoomId roomId : active.get()) {
      next.put(roomId, new CompletableFuture<>());
      lifecycle.released(roomId);
    }
    for (Map.Entry<RoomId, CompletableFuture<Boolean>> entry : awaitingAck.entrySet()) {
      next.put(entry.getKey(), entry.getValue());
      lifecycle.released(entry.getKey());
    }
    next.putAll(queued);
    awaitingAck.clear();
    queued.clear();
    queued.putAll(next);
    active.set(Set.of());
    if (!queued.isEmpty()) {
      log.info("Connection lost; {} room(s) will be re-joined", queued.size());
    }
  }

  private void dropAll() {
    for (RoomId roomId : active.get()) {
      lifecycle.released(roomId);
    }
    for (Map.Entry<RoomId, CompletableFuture<Boolean>> entry : awaitingAck.entrySet()) {
      lifecycle.released(entry.getKey());
      entry.getValue().complete(Boolean.FALSE);
    }
    for (CompletableFuture<Boolean> pending : queued.values()) {
      pending.complete(Boolean.FALSE);
    }
    awaitingAck.clear();
    queued.clear();
    active.set(Set.of());
  }

  /**
   * Fails every queued join, e.g. when the server refused registration and the queue can never be flushed.
   *
   * @param error failure handed to the waiting callers
   */
  void failQueued(Throwable error) {
    if (!queued.isEmpty()) {
      log.warn("Abandoning {} queued join(s): {}", queued.size(), error.getMessage());
    }
    List<CompletableFuture<Boolean>> pending = new ArrayList<>(queued.values());
    queued.clear();
    for (CompletableFuture<Boolean> joined : pending) {
      joined.completeExceptionally(error);
    }
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
