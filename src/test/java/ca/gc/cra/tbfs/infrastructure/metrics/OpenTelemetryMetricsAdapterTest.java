package ca.gc.cra.tbfs.infrastructure.metrics;

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
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("tbfs.metric.key");

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
    adapter.increment("read.records");
    adapter.increment("read.records");
    adapter.increment("read.records");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "tbfs.read.records").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("read.records", point.getAttributes().get(METRIC_KEY));

    assertEquals("tbfs", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("read.sources.active", 1L);
    adapter.observe("read.sources.active", 2L);
    adapter.observe("read.sources.active", 2L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "tbfs.read.sources.active").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(3L, point.getCount());
    assertEquals(5.0, point.getSum());
    assertEquals("read.sources.active", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void instrumentNamesArePrefixedAndSanitized() {
    assertEquals("tbfs.write.loader.failed", OpenTelemetryMetricsAdapter.instrumentName("write.loader.failed"));
    assertEquals("tbfs.read_sources", OpenTelemetryMetricsAdapter.instrumentName(" Read Sources "));
    assertEquals("tbfs.metric", OpenTelemetryMetricsAdapter.instrumentName(" "));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
