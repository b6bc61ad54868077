package com.pourrice.chat.application.chat;

import com.pourrice.chat.application.port.ChatEventListener;
import com.pourrice.chat.application.port.IdentityProvider;
import com.pourrice.chat.application.port.MetricsPort;
import com.pourrice.chat.application.util.ObservableValue;
import com.pourrice.chat.application.util.StateCell;
import com.pourrice.chat.domain.chat.ConnectionState;
import com.pourrice.chat.domain.chat.PresenceEvent;
import com.pourrice.chat.domain.chat.UserIdentity;
import com.pourrice.chat.domain.protocol.RegisterRequest;
import com.pourrice.chat.domain.protocol.RegistrationAck;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Registers the local identity on every new connection and tracks who is online.
 * <p><strong>Why:</strong> Room operations are only valid once the server bound the connection to a user;
 * {@link #registered()} is the gate the session pipeline waits on.</p>
 * <p><strong>Thread-safety:</strong> Confined to the event loop; {@link #isUserOnline(String)} and
 * {@link #onlineUsers()} may be read from any thread.</p>
 * <p><strong>Observability:</strong> Emits {@code chat.registration.ack}.</p>
 *
 * @since 0.1.0
 */
public final class RegistrationCoordinator {
  private static final Logger log = LoggerFactory.getLogger(RegistrationCoordinator.class);

  private final ConnectionManager connection;
  private final AuthorizedEmitter emitter;
  private final IdentityProvider identity;
  private final ChatEventListener listener;
  private final MetricsPort metrics;
  private final StateCell<Boolean> registered = new StateCell<>("registered", Boolean.FALSE);
  private final Map<String, PresenceEvent> online = new ConcurrentHashMap<>();
  private boolean awaitingAck;
  private boolean rejected;
  private Runnable rejectionHandler = () -> {};

  RegistrationCoordinator(
      ConnectionManager connection,
      AuthorizedEmitter emitter,
      IdentityProvider identity,
      ChatEventListener listener,
      MetricsPort metrics) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.emitter = Objects.requireNonNull(emitter, "emitter");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    connection.state().subscribe(this::onConnectionState);
  }

  /**
   * Returns whether the server acknowledged registration on the current connection.
   *
   * @return observable registration flag
   */
  public ObservableValue<Boolean> registered() {
    return registered;
  }

  /**
   * Indicates whether the server refused registration on the current connection. Cleared when the connection changes.
   *
   * @return {@code true} after a {@code registered} acknowledgement with {@code success=false}
   */
  boolean isRejected() {
    return rejected;
  }

  /**
   * Sets the callback run on the event loop when the server refuses registration.
   *
   * @param handler rejection callback
   */
  void onRejected(Runnable handler) {
    this.rejectionHandler = Objects.requireNonNull(handler, "handler");
  }

  /**
   * Indicates whether a {@code user-online} was seen for the user without a later {@code user-offline}.
   *
   * @param userId user to check
   * @return {@code true} when online
   */
  public boolean isUserOnline(String userId) {
    return userId != null && online.containsKey(userId);
  }

  /**
   * Returns the ids of users currently known to be online.
   *
   * @return immutable snapshot
   */
  public Set<String> onlineUsers() {
    return Set.copyOf(online.keySet());
  }

  void onRegistered(RegistrationAck ack) {
    if (!awaitingAck || !connection.isConnected()) {
      log.debug("Ignoring registration ack for {} outside a registration attempt", ack.userId());
      return;
    }
    awaitingAck = false;
    if (!ack.success()) {
      log.warn("Chat server rejected registration of {}", ack.userId());
      rejected = true;
      rejectionHandler.run();
      return;
    }
    metrics.increment("chat.registration.ack");
    log.info("Registered {} on chat connection {}", ack.userId(), ack.socketId());
    registered.set(Boolean.TRUE);
  }

  void onPresence(PresenceEvent event) {
    if (event.online()) {
      online.put(event.userId(), event);
    } else {
      online.remove(event.userId());
    }
    listener.onPresence(event);
  }

  private void onConnectionState(ConnectionState state) {
    rejected = false;
    if (state == ConnectionState.CONNECTED) {
      register();
      return;
    }
    awaitingAck = false;
    registered.set(Boolean.FALSE);
    if (state == ConnectionState.DISCONNECTED) {
      online.clear();
    }
  }

  private void register() {
    Optional<UserIdentity> user = identity.currentUser();
    if (user.isEmpty()) {
      log.warn("Connected without a signed-in user; skipping registration");
      return;
    }
    UserIdentity self = user.get();
    awaitingAck = true;
    emitter.emit(token -> new RegisterRequest(self.userId(), self.effectiveDisplayName(), token))
        .whenComplete((ignored, error) -> {
          if (error != null) {
            log.warn("Registration of {} could not be sent: {}", self.userId(), error.getMessage());
          }
        });
  }
}
