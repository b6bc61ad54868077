package com.pourrice.chat.infrastructure.auth;

import com.pourrice.chat.application.port.TokenProvider;
import com.pourrice.chat.domain.error.NotAuthenticatedException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link TokenProvider} returning a token supplied through configuration. An empty token fails every fetch with
 * {@link NotAuthenticatedException}.
 *
 * @since 0.1.0
 */
public final class StaticTokenProvider implements TokenProvider {
  private final String token;

  /**
   * Creates a provider.
   *
   * @param token bearer token; blank means signed out
   */
  public StaticTokenProvider(String token) {
    this.token = Objects.requireNonNullElse(token, "").trim();
  }

  @Override
  public CompletableFuture<String> fetchToken() {
    if (token.isEmpty()) {
      return CompletableFuture.failedFuture(new NotAuthenticatedException("No auth token configured"));
    }
    return CompletableFuture.completedFuture(token);
  }

  @Override
  public String toString() {
    return "StaticTokenProvider[token=" + (token.isEmpty() ? "<none>" : "<redacted>") + "]";
  }
}
