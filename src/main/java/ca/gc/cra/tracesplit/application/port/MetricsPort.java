package ca.gc.cra.tracesplit.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission.
 * <p><strong>Why:</strong> Lets the split pipeline record counters and size observations without binding to a vendor
 * SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code split.records.emitted}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code split.labels.loaded}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Adds {@code amount} to the named counter.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param amount non-negative increment
   */
  default void add(String key, long amount) {
    for (long i = 0; i < amount; i++) {
      increment(key);
    }
  }

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value such as a partition size or a duration in milliseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
