package com.pourrice.chat.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * OpenTelemetry export settings resolved from configuration.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint, e.g. {@code http://localhost:4317}
 * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}; may be empty
 * @since 0.1.0
 */
public record TelemetrySettings(TelemetrySettings.Exporter exporter, String endpoint, String resourceAttributes) {
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = Objects.requireNonNullElse(resourceAttributes, "").trim();
  }

  /**
   * Settings that disable export.
   *
   * @return exporter {@code none}
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, DEFAULT_ENDPOINT, "");
  }

  /**
   * Supported exporters.
   */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses a configuration value.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive
     * @return exporter
     * @throws IllegalArgumentException for other values
     */
    public static Exporter parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none", "" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      };
    }
  }
}
