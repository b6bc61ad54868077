package com.pourrice.chat.config;

import com.pourrice.chat.application.chat.ChatSession;
import com.pourrice.chat.infrastructure.exec.EventLoopScheduler;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A wired chat session together with the resources it runs on. Closing the runtime ends the session and
 * releases the event loop, the HTTP client and the metrics exporter.
 *
 * @since 0.1.0
 */
public final class ChatRuntime implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ChatRuntime.class);
  private static final long SHUTDOWN_TIMEOUT_MILLIS = 5_000L;

  private final ChatSession session;
  private final EventLoopScheduler scheduler;
  private final OkHttpClient httpClient;
  private final AutoCloseable metrics;

  ChatRuntime(ChatSession session, EventLoopScheduler scheduler, OkHttpClient httpClient, AutoCloseable metrics) {
    this.session = Objects.requireNonNull(session, "session");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.metrics = metrics;
  }

  /**
   * Returns the session.
   *
   * @return chat session
   */
  public ChatSession session() {
    return session;
  }

  @Override
  public void close() {
    try {
      session.shutdown().get(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while closing chat session");
    } catch (ExecutionException ex) {
      log.warn("Chat session closed with error: {}", ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage());
    } catch (TimeoutException ex) {
      log.warn("Chat session did not close within {} ms", SHUTDOWN_TIMEOUT_MILLIS);
    }
    scheduler.close();
    httpClient.dispatcher().executorService().shutdown();
    httpClient.connectionPool().evictAll();
    if (metrics != null) {
      try {
        metrics.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
