package ca.gc.cra.tracesplit.application.pipeline;

import ca.gc.cra.tracesplit.application.port.LabelStoreReader;
import ca.gc.cra.tracesplit.application.port.MetricsPort;
import ca.gc.cra.tracesplit.application.port.SplitRecordSink;
import ca.gc.cra.tracesplit.application.split.SplitterSettings;
import ca.gc.cra.tracesplit.application.split.TraceSelector;
import ca.gc.cra.tracesplit.application.split.TraceSplitter;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.split.SplitRecord;
import ca.gc.cra.tracesplit.domain.trace.LabelSummary;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import ca.gc.cra.tracesplit.logging.Logs;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Loads a label store, computes every split record, and writes them to a sink.
 * <p><strong>Why:</strong> Ties the selection and splitting services to concrete input and output adapters.</p>
 * <p><strong>Role:</strong> Application-layer use case behind the {@code split} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the label table and log its summary.</li>
 *   <li>Fork the seeded root generator for selection before handing it to the splitter.</li>
 *   <li>Open the sink only after all records are computed and verified, so a failure leaves no partial output.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} once.</p>
 * <p><strong>Observability:</strong> Emits {@code split.*} metrics and puts {@code split.repetition} in the MDC while
 * writing.</p>
 *
 * @since 0.1.0
 */
public final class SplitUseCase {
  private static final Logger log = LoggerFactory.getLogger(SplitUseCase.class);
  private static final String MDC_REPETITION = "split.repetition";
  private static final int PREVIEW_ITEMS = 8;

  private final SplitterSettings settings;
  private final TraceSelector selector;
  private final LabelStoreReader reader;
  private final SplitRecordSinkFactory sinkFactory;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param settings split parameters including the seed
   * @param selector trace selector; pass a disabled selector to split the whole table
   * @param reader label store reader
   * @param sinkFactory opens the output sink after splitting
   * @param metrics metrics port
   */
  public SplitUseCase(
      SplitterSettings settings,
      TraceSelector selector,
      LabelStoreReader reader,
      SplitRecordSinkFactory sinkFactory,
      MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.selector = Objects.requireNonNull(selector, "selector");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.sinkFactory = Objects.requireNonNull(sinkFactory, "sinkFactory");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the pipeline.
   *
   * @return number of records written
   * @throws Exception if loading, splitting, verification, or writing fails
   */
  public int run() throws Exception {
    long started = System.nanoTime();
    log.info("Loading labels from {}", reader.describe());
    LabelTable table = reader.read();
    metrics.add("split.labels.loaded", table.size());
    LabelSummary summary = LabelSummary.of(table);
    log.info("Loaded {} samples ({} monitored across {} classes, {} unmonitored in {} groups), protocols {}",
        summary.samples(), summary.monitoredSamples(), summary.monitoredClasses(),
        summary.unmonitoredSamples(), summary.unmonitoredGroups(), summary.samplesPerProtocol());

    SplitRandom root = SplitRandom.seeded(settings.seed());
    int[] universe = selector.select(table, root.fork());
    if (selector.enabled()) {
      log.info("Trace selection kept {} of {} samples", universe.length, table.size());
    }
    List<SplitRecord> records = new TraceSplitter(settings).split(table, universe, root);

    int written = 0;
    try (SplitRecordSink sink = sinkFactory.open()) {
      for (SplitRecord record : records) {
        String previous = MDC.get(MDC_REPETITION);
        try {
          MDC.put(MDC_REPETITION, Integer.toString(record.repetition()));
          sink.write(record);
          written++;
          metrics.increment("split.records.emitted");
          metrics.observe("split.train.size", record.train().length);
          metrics.observe("split.val.size", record.validation().length);
          metrics.observe("split.test.size", record.test().length);
          if (log.isDebugEnabled()) {
            log.debug("Wrote split train={} val={} test={}",
                Logs.preview(record.train(), PREVIEW_ITEMS),
                Logs.preview(record.validation(), PREVIEW_ITEMS),
                Logs.preview(record.test(), PREVIEW_ITEMS));
          }
        } finally {
          if (previous == null) {
            MDC.remove(MDC_REPETITION);
          } else {
            MDC.put(MDC_REPETITION, previous);
          }
        }
      }
      sink.flush();
    } catch (Exception ex) {
      log.error("Split pipeline failed after writing {} of {} records", written, records.size(), ex);
      throw ex;
    }
    long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;
    metrics.observe("split.duration.ms", elapsedMillis);
    log.info("Split pipeline wrote {} records in {} ms", written, elapsedMillis);
    return written;
  }
}
