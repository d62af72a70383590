package ca.gc.cra.tracesplit.config;

import ca.gc.cra.tracesplit.application.pipeline.SplitRecordSinkFactory;
import ca.gc.cra.tracesplit.application.pipeline.SplitUseCase;
import ca.gc.cra.tracesplit.application.port.LabelStoreReader;
import ca.gc.cra.tracesplit.application.port.MetricsPort;
import ca.gc.cra.tracesplit.application.split.TraceSelector;
import ca.gc.cra.tracesplit.infrastructure.labels.LabelStoreReaders;
import ca.gc.cra.tracesplit.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.tracesplit.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.tracesplit.infrastructure.persistence.NdjsonSplitRecordSink;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires adapters and use cases for the CLI commands.
 * <p><strong>Role:</strong> Composition root; the only place that names concrete infrastructure classes.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} shuts the metrics adapter down, pushing pending metrics.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final MetricsPort metrics;

  /**
   * Creates a root whose metrics adapter follows {@code metricsExporter}.
   *
   * @param metricsExporter {@code otlp} or {@code none}
   */
  public CompositionRoot(String metricsExporter) {
    this(metricsFor(metricsExporter));
  }

  /**
   * Creates a root with an explicit metrics port.
   *
   * @param metrics metrics port shared by the use cases
   */
  public CompositionRoot(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the shared metrics port.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Creates the reader for a label store.
   *
   * @param source store location and format
   * @return reader
   */
  public LabelStoreReader labelStoreReader(LabelSource source) {
    return LabelStoreReaders.forPath(source.input(), source.format(), source.dataset());
  }

  /**
   * Creates the split use case.
   *
   * @param config split configuration
   * @param allowOverwrite whether an existing output file may be replaced
   * @return use case ready to run
   */
  public SplitUseCase splitUseCase(SplitConfig config, boolean allowOverwrite) {
    Objects.requireNonNull(config, "config");
    return new SplitUseCase(
        config.toSettings(),
        new TraceSelector(config.tracesPerClass(), config.nClasses()),
        labelStoreReader(config.source()),
        sinkFactory(config, allowOverwrite),
        metrics);
  }

  private static SplitRecordSinkFactory sinkFactory(SplitConfig config, boolean allowOverwrite) {
    if (config.output().isEmpty()) {
      return NdjsonSplitRecordSink::toStdout;
    }
    Path output = config.output().get();
    return () -> NdjsonSplitRecordSink.toFile(output, allowOverwrite);
  }

  static MetricsPort metricsFor(String exporter) {
    String normalized = exporter == null ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "", "none" -> new NoOpMetricsAdapter();
      case "otlp" -> new OpenTelemetryMetricsAdapter();
      default -> throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + exporter + ")");
    };
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
