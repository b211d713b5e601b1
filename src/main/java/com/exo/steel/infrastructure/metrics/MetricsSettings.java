package com.exo.steel.infrastructure.metrics;

import com.exo.steel.validation.Numbers;
import com.exo.steel.validation.Strings;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Metrics export settings resolved from configuration.
 *
 * <p>The {@code otel.metrics.exporter} / {@code otel.exporter.otlp.endpoint} system properties and the
 * {@code OTEL_METRICS_EXPORTER} / {@code OTEL_EXPORTER_OTLP_ENDPOINT} environment variables override the
 * configured values, in that order.</p>
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param exportInterval push interval
 * @since 0.1.0
 */
public record MetricsSettings(String exporter, String endpoint, Duration exportInterval) {
  /** Default exporter. */
  public static final String DEFAULT_EXPORTER = "none";
  /** Default OTLP endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public MetricsSettings {
    exporter = Strings.requireNonBlank("metrics.exporter", exporter).toLowerCase(Locale.ROOT);
    endpoint = Strings.requireNonBlank("metrics.endpoint", endpoint);
    Objects.requireNonNull(exportInterval, "exportInterval");
    Numbers.requireRange("metrics.exportIntervalSeconds", exportInterval.toSeconds(), 1, 3_600);
  }

  /**
   * @return metrics disabled, 30 s interval
   */
  public static MetricsSettings defaults() {
    return new MetricsSettings(DEFAULT_EXPORTER, DEFAULT_ENDPOINT, Duration.ofSeconds(30));
  }

  /**
   * Applies system property and environment overrides.
   *
   * @return effective settings
   */
  public MetricsSettings withEnvironmentOverrides() {
    String effectiveExporter = firstNonBlank(
        System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), exporter);
    String effectiveEndpoint = firstNonBlank(
        System.getProperty("otel.exporter.otlp.endpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"), endpoint);
    return new MetricsSettings(effectiveExporter, effectiveEndpoint, exportInterval);
  }

  /**
   * @return {@code true} when an exporter other than {@code none} is selected
   */
  public boolean enabled() {
    return !"none".equals(exporter);
  }

  private static String firstNonBlank(String first, String second, String fallback) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return fallback;
  }
}
