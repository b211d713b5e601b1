package com.exo.steel.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
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
  void incrementExportsCounterWithKeyAttributeAndResource() {
    adapter.increment("flow.transition.scanning");
    adapter.increment("flow.transition.scanning");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "flow.transition.scanning").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("flow.transition.scanning",
        point.getAttributes().get(AttributeKey.stringKey("steel.metric.key")));
    assertEquals("steel-consent", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("com.exo", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeExportsHistogram() {
    adapter.observe("flow.reveal.latencyMillis", 4_900);
    adapter.observe("flow.reveal.latencyMillis", 100);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "flow.reveal.latencymillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(5_000.0, point.getSum());
    assertEquals("flow.reveal.latencyMillis",
        point.getAttributes().get(AttributeKey.stringKey("steel.metric.key")));
  }

  @Test
  void sanitizeNameReplacesUnsupportedCharacters() {
    assertEquals("feedback.tag-detected", OpenTelemetryMetricsAdapter.sanitizeName("feedback.tag-detected"));
    assertEquals("m1.flow_x", OpenTelemetryMetricsAdapter.sanitizeName("1.Flow x"));
    assertEquals("steel.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void disabledExporterYieldsNoopAdapter() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(
        new MetricsSettings("none", MetricsSettings.DEFAULT_ENDPOINT, Duration.ofSeconds(30)))) {
      noop.increment("flow.transition.idle");
      noop.observe("flow.reveal.latencyMillis", 1);
      assertTrue(noop.isNoop());
    }
  }

  @Test
  void unknownExporterFallsBackToNoop() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(
        new MetricsSettings("prometheus", MetricsSettings.DEFAULT_ENDPOINT, Duration.ofSeconds(30)))) {
      assertTrue(noop.isNoop() || System.getenv("OTEL_METRICS_EXPORTER") != null);
    }
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
