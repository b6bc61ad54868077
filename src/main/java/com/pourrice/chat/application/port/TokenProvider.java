package com.pourrice.chat.application.port;

import java.util.concurrent.CompletableFuture;

/**
 * Supplies short-lived bearer tokens. Called once per outbound request; tokens are never cached by the chat
 * layer.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TokenProvider {
  /**
   * Fetches a token for the signed-in user.
   *
   * @return future completed with the token, or exceptionally when none can be issued
   */
  CompletableFuture<String> fetchToken();
}
