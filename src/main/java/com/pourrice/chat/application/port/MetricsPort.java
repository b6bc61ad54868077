package com.pourrice.chat.application.port;

/**
 * <strong>What:</strong> Port abstracting chat metrics emission.
 * <p><strong>Why:</strong> Lets the session count reconnects, duplicates and uploads without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept calls from the event loop and from HTTP callback
 * threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code chat.message.duplicate}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code chat.connection.reconnect}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., bytes uploaded)
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
