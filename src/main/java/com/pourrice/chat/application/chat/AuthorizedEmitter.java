package com.pourrice.chat.application.chat;

import com.pourrice.chat.application.port.SchedulerPort;
import com.pourrice.chat.application.port.TokenProvider;
import com.pourrice.chat.domain.error.NotAuthenticatedException;
import com.pourrice.chat.domain.error.NotConnectedException;
import com.pourrice.chat.domain.error.NotRegisteredException;
import com.pourrice.chat.domain.protocol.OutboundEvent;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Sends events that carry a bearer token.
 *
 * <p>A fresh token is fetched for every event. The event is built and sent back on the event loop once the token
 * arrives, after re-checking the connection and the caller's precondition, since both may have changed while the
 * token was being fetched.</p>
 *
 * @since 0.1.0
 */
final class AuthorizedEmitter {
  private final ConnectionManager connection;
  private final TokenProvider tokens;
  private final SchedulerPort scheduler;

  AuthorizedEmitter(ConnectionManager connection, TokenProvider tokens, SchedulerPort scheduler) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.tokens = Objects.requireNonNull(tokens, "tokens");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  /**
   * Fetches a token, then sends the event built from it.
   *
   * @param build builds the event from the token
   * @return future completed once the transport accepted the event
   */
  CompletableFuture<Void> emit(Function<String, ? extends OutboundEvent> build) {
    return emitWhen(() -> true, build);
  }

  /**
   * Like {@link #emit(Function)} but fails with {@link NotRegisteredException} when {@code ready} is false at send
   * time.
   *
   * @param ready precondition evaluated on the event loop right before sending
   * @param build builds the event from the token
   * @return future completed once the transport accepted the event
   */
  CompletableFuture<Void> emitWhen(BooleanSupplier ready, Function<String, ? extends OutboundEvent> build) {
    if (!connection.isConnected()) {
      return CompletableFuture.failedFuture(new NotConnectedException("Chat is not connected"));
    }
    CompletableFuture<Void> result = new CompletableFuture<>();
    CompletableFuture<String> token;
    try {
      token = tokens.fetchToken();
    } catch (RuntimeException ex) {
      token = CompletableFuture.failedFuture(ex);
    }
    token.whenCompleteAsync((value, error) -> {
      if (error != null || value == null || value.isBlank()) {
        result.completeExceptionally(new NotAuthenticatedException("Auth token unavailable", error));
        return;
      }
      if (!ready.getAsBoolean()) {
        result.completeExceptionally(new NotRegisteredException("Registration not acknowledged"));
        return;
      }
      if (!connection.send(build.apply(value))) {
        result.completeExceptionally(new NotConnectedException("Chat is not connected"));
        return;
      }
      result.complete(null);
    }, scheduler);
    return result;
  }
}
