package com.pourrice.chat.application.chat;

import com.pourrice.chat.application.port.IdentityProvider;
import com.pourrice.chat.application.port.MetricsPort;
import com.pourrice.chat.application.port.SchedulerPort;
import com.pourrice.chat.application.port.TransportListener;
import com.pourrice.chat.application.port.TransportPort;
import com.pourrice.chat.application.util.ObservableValue;
import com.pourrice.chat.application.util.StateCell;
import com.pourrice.chat.domain.chat.ConnectionState;
import com.pourrice.chat.domain.error.NotAuthenticatedException;
import com.pourrice.chat.domain.error.NotConnectedException;
import com.pourrice.chat.domain.protocol.InboundEvent;
import com.pourrice.chat.domain.protocol.OutboundEvent;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the single chat connection: opening, closing and reconnecting it.
 * <p><strong>Why:</strong> Every other component observes {@link #state()} instead of touching the transport's
 * lifecycle, so a connection loss resets registration, rooms, history waits and typing in one place.</p>
 * <p><strong>Reconnection:</strong> After an unexpected close the manager retries with the configured
 * {@link ReconnectPolicy}. The state stays {@link ConnectionState#CONNECTING} while retries are pending and becomes
 * {@link ConnectionState#DISCONNECTED} once they are exhausted.</p>
 * <p><strong>Thread-safety:</strong> Confined to the session event loop. Transport callbacks are re-dispatched onto
 * the loop and tagged with a connection generation so callbacks of a replaced connection are dropped.</p>
 * <p><strong>Observability:</strong> Emits {@code chat.connection.attempt}, {@code chat.connection.reconnect} and
 * {@code chat.connection.failed}.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionManager {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final TransportPort transport;
  private final SchedulerPort scheduler;
  private final IdentityProvider identity;
  private final URI endpoint;
  private final ReconnectPolicy policy;
  private final MetricsPort metrics;
  private final StateCell<ConnectionState> state =
      new StateCell<>("connection", ConnectionState.DISCONNECTED);

  private Consumer<InboundEvent> inboundHandler = event -> {};
  private CompletableFuture<Void> pendingConnect;
  private SchedulerPort.ScheduledTask reconnectTimer;
  private boolean wantConnected;
  private int attempt;
  private long generation;

  /**
   * Creates a manager for one endpoint.
   *
   * @param transport connection implementation
   * @param scheduler session event loop
   * @param identity local identity source; a connection requires a signed-in user
   * @param endpoint server endpoint
   * @param policy reconnect backoff
   * @param metrics metrics sink
   */
  public ConnectionManager(
      TransportPort transport,
      SchedulerPort scheduler,
      IdentityProvider identity,
      URI endpoint,
      ReconnectPolicy policy,
      MetricsPort metrics) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.identity = Objects.requireNonNull(identity, "identity");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Installs the receiver of decoded inbound events. Events are delivered on the event loop.
   *
   * @param handler inbound event handler
   */
  public void onInbound(Consumer<InboundEvent> handler) {
    this.inboundHandler = Objects.requireNonNull(handler, "handler");
  }

  /**
   * Opens the connection. Idempotent while connecting or connected.
   *
   * @return future completed once connected; failed with {@link NotAuthenticatedException} when nobody is signed in
   *     or with {@link NotConnectedException} when every attempt failed or {@link #disconnect()} intervened
   */
  public CompletableFuture<Void> connect() {
    ConnectionState current = state.get();
    if (current == ConnectionState.CONNECTED) {
      return CompletableFuture.completedFuture(null);
    }
    if (current == ConnectionState.CONNECTING && pendingConnect != null) {
      return pendingConnect;
    }
    if (identity.currentUser().isEmpty()) {
      log.warn("Chat connection requested without a signed-in user");
      return CompletableFuture.failedFuture(new NotAuthenticatedException("No local user identity"));
    }
    pendingConnect = new CompletableFuture<>();
    wantConnected = true;
    attempt = 0;
    openTransport();
    return pendingConnect;
  }

  /**
   * Closes the connection and stops reconnecting. Dependents reset themselves on the
   * {@link ConnectionState#DISCONNECTED} transition.
   */
  public void disconnect() {
    wantConnected = false;
    cancelReconnectTimer();
    generation++;
    transport.close();
    if (state.set(ConnectionState.DISCONNECTED)) {
      log.info("Chat connection to {} closed", endpoint);
    }
    failPendingConnect(new NotConnectedException("Disconnected"));
  }

  /**
   * Returns the observable connection state.
   *
   * @return connection state
   */
  public ObservableValue<ConnectionState> state() {
    return state;
  }

  /**
   * Indicates whether the connection is open.
   *
   * @return {@code true} when {@link ConnectionState#CONNECTED}
   */
  public boolean isConnected() {
    return state.get() == ConnectionState.CONNECTED;
  }

  /**
   * Sends an event over the open connection.
   *
   * @param event event to send
   * @return {@code false} when not connected or the transport rejected the event
   */
  public boolean send(OutboundEvent event) {
    Objects.requireNonNull(event, "event");
    if (!isConnected()) {
      log.debug("Dropping {} while {}", event.name().wireName(), state.get());
      return false;
    }
    return transport.send(event);
  }

  private void openTransport() {
    reconnectTimer = null;
    long current = ++generation;
    state.set(ConnectionState.CONNECTING);
    metrics.increment("chat.connection.attempt");
    log.info("Opening chat connection to {} (attempt {})", endpoint, attempt + 1);
    transport.open(endpoint, new GenerationListener(current));
  }

  private void handleOpen() {
    attempt = 0;
    if (state.set(ConnectionState.CONNECTED)) {
      log.info("Chat connection to {} established", endpoint);
    }
    CompletableFuture<Void> connected = pendingConnect;
    pendingConnect = null;
    if (connected != null) {
      connected.complete(null);
    }
  }

  private void handleLoss(String reason, Throwable error) {
    if (!wantConnected) {
      return;
    }
    if (error != null) {
      log.info("Chat connection to {} failed: {}", endpoint, error.toString());
    } else {
      log.info("Chat connection to {} closed by peer: {}", endpoint, reason);
    }
    generation++;
    if (attempt >= policy.maxAttempts()) {
      wantConnected = false;
      metrics.increment("chat.connection.failed");
      log.warn("Giving up on chat connection to {} after {} reconnect attempts", endpoint, attempt);
      state.set(ConnectionState.DISCONNECTED);
      failPendingConnect(new NotConnectedException("Could not connect to " + endpoint, error));
      return;
    }
    long delay = policy.delayForAttempt(attempt);
    attempt++;
    metrics.increment("chat.connection.reconnect");
    log.info("Reconnecting to {} in {} ms (attempt {}/{})", endpoint, delay, attempt, policy.maxAttempts());
    state.set(ConnectionState.CONNECTING);
    if (pendingConnect == null) {
      pendingConnect = new CompletableFuture<>();
    }
    reconnectTimer = scheduler.schedule(this::openTransport, delay);
  }

  private void cancelReconnectTimer() {
    if (reconnectTimer != null) {
      reconnectTimer.cancel();
      reconnectTimer = null;
    }
  }

  private void failPendingConnect(Throwable error) {
    CompletableFuture<Void> failed = pendingConnect;
    pendingConnect = null;
    if (failed != null) {
      failed.completeExceptionally(error);
    }
  }

  private final class GenerationListener implements TransportListener {
    private final long connection;

    GenerationListener(long connection) {
      this.connection = connection;
    }

    @Override
    public void onOpen() {
      scheduler.execute(() -> {
        if (connection == generation) {
          handleOpen();
        }
      });
    }

    @Override
    public void onEvent(InboundEvent event) {
      scheduler.execute(() -> {
        if (connection == generation) {
          inboundHandler.accept(event);
        }
      });
    }

    @Override
    public void onClosed(String reason) {
      scheduler.execute(() -> {
        if (connection == generation) {
          handleLoss(reason, null);
        }
      });
    }

    @Override
    public void onFailure(Throwable error) {
      scheduler.execute(() -> {
        if (connection == generation) {
          handleLoss(null, error);
        }
      });
    }
  }
}
