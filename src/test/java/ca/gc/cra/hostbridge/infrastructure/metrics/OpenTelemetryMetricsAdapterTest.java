package ca.gc.cra.hostbridge.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTRIBUTE = AttributeKey.stringKey("bridge.metric.key");

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
  void incrementRecordsCounterWithKeyAndResource() {
    adapter.increment("bridge.command.succeeded");
    adapter.increment("bridge.command.succeeded");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "bridge.command.succeeded");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("bridge.command.succeeded", point.getAttributes().get(KEY_ATTRIBUTE));
    assertEquals("hostbridge", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsNanosecondHistogram() {
    adapter.observe("bridge.command.latencyNanos", 1_500L);
    adapter.observe("bridge.command.latencyNanos", 2_500L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "bridge.command.latencynanos");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ns", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
    assertEquals("bridge.command.latencyNanos", point.getAttributes().get(KEY_ATTRIBUTE));
  }

  @Test
  void sanitizeNameLowercasesAndReplacesInvalidCharacters() {
    assertEquals("bridge.command.failed.host_exception",
        OpenTelemetryMetricsAdapter.sanitizeName("bridge.command.failed.HOST_EXCEPTION"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("bridge.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitizeName("a b"));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    MetricData match = metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst().orElse(null);
    assertTrue(match != null, "Expected metric " + name + " in " + metrics);
    return match;
  }
}
