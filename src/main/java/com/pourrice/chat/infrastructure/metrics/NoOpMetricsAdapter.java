package com.pourrice.chat.infrastructure.metrics;

import com.pourrice.chat.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Selected by {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
