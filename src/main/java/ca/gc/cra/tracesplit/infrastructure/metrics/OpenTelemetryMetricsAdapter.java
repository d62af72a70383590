package ca.gc.cra.tracesplit.infrastructure.metrics;

import ca.gc.cra.tracesplit.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards split counters and histograms to OpenTelemetry.
 *
 * <p>Closing the adapter flushes pending metrics and shuts the meter provider down.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("tracesplit.metric.key");
  private static final String FALLBACK_METRIC_NAME = "tracesplit.metric";

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final Meter meter;
  private final Map<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final Map<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter selected by system properties or environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
    if (handle.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    add(key, 1L);
  }

  @Override
  public void add(String key, long amount) {
    Instrument<LongCounter> counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::counter);
    counter.instrument().add(amount, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> histogram =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::histogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  void forceFlush() {
    handle.forceFlush();
  }

  @Override
  public void close() {
    handle.forceFlush();
    handle.close();
  }

  private Instrument<LongCounter> counter(String key) {
    LongCounter counter = meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("tracesplit counter for " + key)
        .build();
    return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Instrument<LongHistogram> histogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("tracesplit observation for " + key)
        .build();
    return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Instrument<T>(T instrument, Attributes attributes) {}
}
