package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.Split;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.split.SplitRecord;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Produces the verified split records of a run.
 * <p><strong>Why:</strong> Monitored and unmonitored samples follow different partitioning rules but must be
 * emitted as one record per repetition.</p>
 * <p><strong>Role:</strong> Application service invoked by the split use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fork the supplied generator for the monitored path, the unmonitored path, and assembly, in that order.</li>
 *   <li>Assemble one record per repetition.</li>
 *   <li>Verify every record before returning any of them.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; a call is single-threaded.</p>
 *
 * @since 0.1.0
 */
public final class TraceSplitter {
  private static final Logger log = LoggerFactory.getLogger(TraceSplitter.class);

  private final SplitterSettings settings;
  private final MonitoredSplitter monitoredSplitter;
  private final UnmonitoredSplitter unmonitoredSplitter;
  private final SplitAssembler assembler;

  /**
   * Creates a splitter with the default collaborators.
   *
   * @param settings split parameters
   */
  public TraceSplitter(SplitterSettings settings) {
    this(settings,
        new MonitoredSplitter(settings, new ProtocolMixer()),
        new UnmonitoredSplitter(settings),
        new SplitAssembler());
  }

  TraceSplitter(
      SplitterSettings settings,
      MonitoredSplitter monitoredSplitter,
      UnmonitoredSplitter unmonitoredSplitter,
      SplitAssembler assembler) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.monitoredSplitter = Objects.requireNonNull(monitoredSplitter, "monitoredSplitter");
    this.unmonitoredSplitter = Objects.requireNonNull(unmonitoredSplitter, "unmonitoredSplitter");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
  }

  /**
   * Splits the universe into verified records.
   *
   * @param table label table
   * @param universe sample indices to partition
   * @param random generator forked once per stage
   * @return {@code nSplits * nRepeats} records ordered by repetition
   * @throws SplitConfigurationException if the universe is empty or too small for the parameters
   * @throws ca.gc.cra.tracesplit.domain.split.SplitInvariantException if a constructed split is invalid
   */
  public List<SplitRecord> split(LabelTable table, int[] universe, SplitRandom random) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(universe, "universe");
    Objects.requireNonNull(random, "random");
    if (universe.length == 0) {
      throw new SplitConfigurationException("the sample universe is empty");
    }
    SplitRandom monitoredRandom = random.fork();
    SplitRandom unmonitoredRandom = random.fork();
    SplitRandom assemblyRandom = random.fork();

    List<Split> monitored = monitoredSplitter.split(table, universe, monitoredRandom);
    List<Split> unmonitored = unmonitoredSplitter.split(table, universe, unmonitoredRandom);
    SortedSet<Integer> classes = monitoredClasses(table, universe);
    boolean expectValidation = settings.hasValidation() && !classes.isEmpty();

    List<SplitRecord> records = new ArrayList<>(settings.repetitions());
    for (int repetition = 0; repetition < settings.repetitions(); repetition++) {
      Split monitoredSplit = monitored.get(repetition);
      SplitInvariants.requireTestMixture(table, repetition, monitoredSplit.test(),
          settings.withMonitoredQuic(), settings.quicFraction(), "monitored");
      SplitRecord record = assembler.assemble(
          repetition, monitoredSplit, unmonitored.get(repetition), assemblyRandom);
      SplitInvariants.requireValid(table, repetition, record.asSplit(), universe, classes, expectValidation);
      records.add(record);
    }
    log.info("Computed {} verified splits over {} samples ({} monitored classes)",
        records.size(), universe.length, classes.size());
    return records;
  }

  private static SortedSet<Integer> monitoredClasses(LabelTable table, int[] universe) {
    SortedSet<Integer> classes = new TreeSet<>();
    for (int index : universe) {
      if (table.isMonitored(index)) {
        classes.add(table.classOf(index));
      }
    }
    return classes;
  }
}
