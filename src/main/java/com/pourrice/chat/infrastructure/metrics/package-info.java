/**
 * Metrics adapters bridging {@link com.pourrice.chat.application.port.MetricsPort} to OpenTelemetry or a no-op sink.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code chat.*} namespace. Message bodies and tokens are never
 * exported; only counters and sizes.</p>
 */
package com.pourrice.chat.infrastructure.metrics;
