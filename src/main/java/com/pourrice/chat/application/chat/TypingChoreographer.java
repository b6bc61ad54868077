package com.pourrice.chat.application.chat;

import com.pourrice.chat.application.port.ChatEventListener;
import com.pourrice.chat.application.port.IdentityProvider;
import com.pourrice.chat.application.port.SchedulerPort;
import com.pourrice.chat.domain.chat.ConnectionState;
import com.pourrice.chat.domain.chat.RoomId;
import com.pourrice.chat.domain.chat.TypingIndicator;
import com.pourrice.chat.domain.chat.UserIdentity;
import com.pourrice.chat.domain.protocol.TypingSignal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Debounces local typing signals and expires remote typing indicators.
 * <p><strong>Local side:</strong> The first keystroke of a typing window sends {@code isTyping=true}; every
 * keystroke re-arms an idle timer that sends {@code isTyping=false} and closes the window.</p>
 * <p><strong>Remote side:</strong> An indicator from another user stays visible until its explicit
 * {@code isTyping=false} or until the expiry timer fires, whichever comes first. Indicators for the local user and
 * for rooms the session does not track are ignored.</p>
 * <p><strong>Timers:</strong> Held in tables keyed by room (local) and by room and user (remote). Leaving a room
 * cancels its timers; a connection change clears every table.</p>
 * <p><strong>Thread-safety:</strong> Confined to the event loop; {@link #typingUsers(RoomId)} may be read anywhere.</p>
 *
 * @since 0.1.0
 */
public final class TypingChoreographer {
  private static final Logger log = LoggerFactory.getLogger(TypingChoreographer.class);

  private final ConnectionManager connection;
  private final SchedulerPort scheduler;
  private final IdentityProvider identity;
  private final ChatEventListener listener;
  private final Predicate<RoomId> tracked;
  private final long idleMillis;
  private final long expiryMillis;
  private final Map<RoomId, SchedulerPort.ScheduledTask> idleTimers = new HashMap<>();
  private final Set<RoomId> openWindows = new HashSet<>();
  private final Map<RoomId, Map<String, RemoteTyper>> remote = new HashMap<>();
  private final Map<RoomId, List<String>> visibleTypers = new ConcurrentHashMap<>();

  TypingChoreographer(
      ConnectionManager connection,
      SchedulerPort scheduler,
      IdentityProvider identity,
      ChatEventListener listener,
      Predicate<RoomId> tracked,
      long idleMillis,
      long expiryMillis) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.tracked = Objects.requireNonNull(tracked, "tracked");
    this.idleMillis = idleMillis;
    this.expiryMillis = expiryMillis;
    connection.state().subscribe(this::onConnectionState);
  }

  /**
   * Records a local keystroke in a room.
   *
   * @param roomId room being typed in
   */
  void notifyTyping(RoomId roomId) {
    Objects.requireNonNull(roomId, "roomId");
    if (!connection.isConnected()) {
      return;
    }
    Optional<UserIdentity> user = identity.currentUser();
    if (user.isEmpty()) {
      return;
    }
    if (openWindows.add(roomId)) {
      send(roomId, user.get(), true);
    }
    SchedulerPort.ScheduledTask previous = idleTimers.remove(roomId);
    if (previous != null) {
      previous.cancel();
    }
    idleTimers.put(roomId, scheduler.schedule(() -> onIdle(roomId), idleMillis));
  }

  /**
   * Ends the local typing window of a room, typically after a send.
   *
   * @param roomId room
   */
  void stopTyping(RoomId roomId) {
    Objects.requireNonNull(roomId, "roomId");
    SchedulerPort.ScheduledTask timer = idleTimers.remove(roomId);
    if (timer != null) {
      timer.cancel();
    }
    if (openWindows.remove(roomId) && connection.isConnected()) {
      identity.currentUser().ifPresent(user -> send(roomId, user, false));
    }
  }

  void onUserTyping(TypingIndicator indicator) {
    String self = identity.currentUser().map(UserIdentity::userId).orElse(null);
    if (indicator.userId().equals(self)) {
      return;
    }
    RoomId roomId = indicator.roomId();
    if (!tracked.test(roomId)) {
      log.debug("Ignoring typing indicator for untracked room {}", roomId);
      return;
    }
    Map<String, RemoteTyper> typers = remote.computeIfAbsent(roomId, key -> new LinkedHashMap<>());
    RemoteTyper previous = typers.remove(indicator.userId());
    if (previous != null) {
      previous.expiry.cancel();
    }
    if (indicator.typing()) {
      RemoteTyper typer = new RemoteTyper(indicator);
      typer.expiry = scheduler.schedule(() -> expire(typer), expiryMillis);
      typers.put(indicator.userId(), typer);
      if (previous == null) {
        publish(indicator);
      }
    } else {
      if (typers.isEmpty()) {
        remote.remove(roomId);
      }
      if (previous != null) {
        publish(indicator);
      }
    }
  }

  /**
   * Returns display names of users currently typing in a room.
   *
   * @param roomId room
   * @return immutable list in the order typing started
   */
  public List<String> typingUsers(RoomId roomId) {
    return visibleTypers.getOrDefault(roomId, List.of());
  }

  /**
   * Cancels every timer of a room without sending anything.
   *
   * @param roomId released room
   */
  void clearRoom(RoomId roomId) {
    SchedulerPort.ScheduledTask timer = idleTimers.remove(roomId);
    if (timer != null) {
      timer.cancel();
    }
    openWindows.remove(roomId);
    Map<String, RemoteTyper> typers = remote.remove(roomId);
    if (typers != null) {
      typers.values().forEach(typer -> typer.expiry.cancel());
    }
    visibleTypers.remove(roomId);
  }

  /**
   * Cancels every timer of every room.
   */
  void clearAll() {
    for (RoomId roomId : roomsWithState()) {
      clearRoom(roomId);
    }
  }

  private Set<RoomId> roomsWithState() {
    Set<RoomId> rooms = new HashSet<>(idleTimers.keySet());
    rooms.addAll(openWindows);
    rooms.addAll(remote.keySet());
    return rooms;
  }

  private void onIdle(RoomId roomId) {
    idleTimers.remove(roomId);
    if (openWindows.remove(roomId) && connection.isConnected()) {
      identity.currentUser().ifPresent(user -> send(roomId, user, false));
    }
  }

  private void expire(RemoteTyper typer) {
    RoomId roomId = typer.indicator.roomId();
    Map<String, RemoteTyper> typers = remote.get(roomId);
    if (typers == null || !typers.remove(typer.indicator.userId(), typer)) {
      return;
    }
    if (typers.isEmpty()) {
      remote.remove(roomId);
    }
    log.debug("Typing indicator of {} in {} expired", typer.indicator.userId(), roomId);
    publish(typer.indicator.stopped());
  }

  private void publish(TypingIndicator change) {
    Map<String, RemoteTyper> typers = remote.get(change.roomId());
    List<String> names = new ArrayList<>();
    if (typers != null) {
      typers.values().forEach(typer -> names.add(typer.indicator.displayName()));
    }
    List<String> snapshot = List.copyOf(names);
    if (snapshot.isEmpty()) {
      visibleTypers.remove(change.roomId());
    } else {
      visibleTypers.put(change.roomId(), snapshot);
    }
    listener.onTypingChanged(change, snapshot);
  }

  private void send(RoomId roomId, UserIdentity user, boolean typing) {
    connection.send(new TypingSignal(roomId, user.userId(), user.effectiveDisplayName(), typing));
  }

  private void onConnectionState(ConnectionState state) {
    if (state != ConnectionState.CONNECTED) {
      clearAll();
    }
  }

  private static final class RemoteTyper {
    private final TypingIndicator indicator;
    private SchedulerPort.ScheduledTask expiry;

    RemoteTyper(TypingIndicator indicator) {
      this.indicator = indicator;
    }
  }
}
