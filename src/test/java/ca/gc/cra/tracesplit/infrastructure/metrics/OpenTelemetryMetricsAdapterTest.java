package ca.gc.cra.tracesplit.infrastructure.metrics;

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
  void countersSumIncrementsAndBulkAdds() {
    adapter.add("split.labels.loaded", 40);
    adapter.increment("split.records.emitted");
    adapter.increment("split.records.emitted");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData loaded = find(metrics, "split.labels.loaded");
    assertEquals(MetricDataType.LONG_SUM, loaded.getType());
    assertEquals(40L, loaded.getLongSumData().getPoints().iterator().next().getValue());

    LongPointData emitted = find(metrics, "split.records.emitted").getLongSumData().getPoints().iterator().next();
    assertEquals(2L, emitted.getValue());
    assertEquals("split.records.emitted",
        emitted.getAttributes().get(AttributeKey.stringKey("tracesplit.metric.key")));
    assertEquals("tracesplit",
        find(metrics, "split.records.emitted").getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observationsLandInHistograms() {
    adapter.observe("split.train.size", 900);
    adapter.observe("split.train.size", 100);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "split.train.size");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(1000.0, point.getSum(), 1e-9);
  }

  @Test
  void sanitizesMetricNames() {
    assertEquals("split.duration.ms", OpenTelemetryMetricsAdapter.sanitizeName("split.duration.ms"));
    assertEquals("m9_lives", OpenTelemetryMetricsAdapter.sanitizeName("9 lives"));
    assertEquals("tracesplit.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
