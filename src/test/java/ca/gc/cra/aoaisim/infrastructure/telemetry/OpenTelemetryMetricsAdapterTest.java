package ca.gc.cra.aoaisim.infrastructure.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    bootstrap = OpenTelemetryBootstrap.forTesting(reader, SimpleSpanProcessor.create(InMemorySpanExporter.create()));
    adapter = new OpenTelemetryMetricsAdapter(bootstrap);
  }

  @AfterEach
  void tearDown() {
    bootstrap.close();
  }

  @Test
  void latencyHistogramsCarryStatusAndDeployment() {
    adapter.observeBaseLatency(0.25, 200, Optional.of("gpt-4o"));
    adapter.observeBaseLatency(0.75, 200, Optional.of("gpt-4o"));
    adapter.observeFullLatency(1.5, 429, Optional.empty());
    bootstrap.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData base = find(metrics, OpenTelemetryMetricsAdapter.LATENCY_BASE);
    assertEquals(MetricDataType.HISTOGRAM, base.getType());
    assertEquals("s", base.getUnit());
    HistogramPointData basePoint = base.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, basePoint.getCount());
    assertEquals(1.0, basePoint.getSum(), 1e-9);
    assertEquals(200L, basePoint.getAttributes().get(OpenTelemetryMetricsAdapter.STATUS_CODE));
    assertEquals("gpt-4o", basePoint.getAttributes().get(OpenTelemetryMetricsAdapter.DEPLOYMENT));

    HistogramPointData fullPoint =
        find(metrics, OpenTelemetryMetricsAdapter.LATENCY_FULL).getHistogramData().getPoints().iterator().next();
    assertEquals(429L, fullPoint.getAttributes().get(OpenTelemetryMetricsAdapter.STATUS_CODE));
    assertNull(fullPoint.getAttributes().get(OpenTelemetryMetricsAdapter.DEPLOYMENT));
  }

  @Test
  void tokenHistogramsAreSeparated() {
    adapter.observeTokensRequested(120, Optional.of("gpt-4o"));
    adapter.observeTokensRequested(0, Optional.of("gpt-4o"));
    adapter.observeTokensUsed(120, Optional.of("gpt-4o"));
    bootstrap.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    HistogramPointData requested = find(metrics, OpenTelemetryMetricsAdapter.TOKENS_REQUESTED)
        .getHistogramData().getPoints().iterator().next();
    HistogramPointData used = find(metrics, OpenTelemetryMetricsAdapter.TOKENS_USED)
        .getHistogramData().getPoints().iterator().next();
    assertEquals(2L, requested.getCount());
    assertEquals(120.0, requested.getSum());
    assertEquals(1L, used.getCount());
    assertEquals("gpt-4o", used.getAttributes().get(OpenTelemetryMetricsAdapter.DEPLOYMENT));
  }

  @Test
  void noopBootstrapRecordsNothing() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult.noop());

    noop.observeBaseLatency(1.0, 200, Optional.empty());
    noop.observeTokensUsed(5, Optional.empty());

    assertTrue(reader.collectAllMetrics().isEmpty());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("Expected metric " + name + " to be exported"));
  }
}
