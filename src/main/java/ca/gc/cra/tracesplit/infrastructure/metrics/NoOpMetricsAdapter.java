package ca.gc.cra.tracesplit.infrastructure.metrics;

import ca.gc.cra.tracesplit.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; selected when {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void add(String key, long amount) {}

  @Override
  public void observe(String key, long value) {}
}
