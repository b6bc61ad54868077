package com.pourrice.chat.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("chat.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithResource() {
    adapter.increment("chat.message.sent");
    adapter.increment("chat.message.sent");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "chat.message.sent").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("chat.message.sent", point.getAttributes().get(METRIC_KEY));
    assertEquals("pourrice-chat", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("com.pourrice", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("chat.attachment.upload.Bytes", 1_024L);
    adapter.observe("chat.attachment.upload.Bytes", 2_048L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "chat.attachment.upload.bytes").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(3_072.0, point.getSum());
    assertEquals("chat.attachment.upload.Bytes", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeNameReplacesUnsupportedCharacters() {
    assertEquals("chat.room_join", OpenTelemetryMetricsAdapter.sanitizeName("chat.room join"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("chat.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match;
  }
}
