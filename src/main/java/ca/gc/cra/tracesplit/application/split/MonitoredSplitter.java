package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.Holdout;
import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.Split;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.split.StratumEncoder;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Closed-world splitter for monitored samples.
 * <p><strong>Role:</strong> First stage of {@link TraceSplitter}; produces one split per repetition.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run repeated stratified k-fold over {@code (class, protocol)} strata.</li>
 *   <li>Restrict training candidates to TCP and carve a class-stratified validation set.</li>
 *   <li>Filter or mix the held-out fold into the test set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; callers supply the random stream.</p>
 *
 * @since 0.1.0
 */
public final class MonitoredSplitter {
  private static final Logger log = LoggerFactory.getLogger(MonitoredSplitter.class);

  private final SplitterSettings settings;
  private final ProtocolMixer mixer;

  /**
   * Creates the splitter.
   *
   * @param settings split parameters
   * @param mixer mixer applied to test folds when monitored QUIC is enabled
   */
  public MonitoredSplitter(SplitterSettings settings, ProtocolMixer mixer) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.mixer = Objects.requireNonNull(mixer, "mixer");
  }

  /**
   * Splits the monitored part of the universe.
   *
   * @param table label table
   * @param universe candidate indices; unmonitored rows are ignored
   * @param random random stream; the k-fold draws come first, then validation and mixing per fold
   * @return {@code nSplits * nRepeats} splits, repeat-major
   * @throws SplitConfigurationException if a stratum or class is too small for the requested partitioning
   */
  public List<Split> split(LabelTable table, int[] universe, SplitRandom random) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(universe, "universe");
    Objects.requireNonNull(random, "random");
    int[] monitored = IndexSets.filter(universe, table::isMonitored);
    if (monitored.length == 0) {
      log.warn("No monitored samples in the universe; monitored partitions will be empty");
      return Collections.nCopies(settings.repetitions(), Split.empty());
    }

    List<Holdout> folds = new StratifiedKFold(settings.nSplits(), settings.nRepeats())
        .split(StratumEncoder.byClassAndProtocol(table, monitored), random);
    List<Split> splits = new ArrayList<>(folds.size());
    for (int repetition = 0; repetition < folds.size(); repetition++) {
      Holdout fold = folds.get(repetition);
      int[] trainValidation = IndexSets.filter(fold.retained(), table::isTcp);
      if (trainValidation.length == 0) {
        throw new SplitConfigurationException(
            "repetition " + repetition + ": no TCP samples left for monitored training");
      }
      Holdout validation = settings.hasValidation()
          ? StratifiedHoldout.split(table, trainValidation, settings.validationFraction(), random)
          : new Holdout(trainValidation, IndexSets.empty());
      int[] test = settings.withMonitoredQuic()
          ? mixer.mix(table, fold.heldOut(), settings.quicFraction(), random)
          : IndexSets.filter(fold.heldOut(), table::isTcp);
      splits.add(new Split(validation.retained(), validation.heldOut(), test));
    }
    log.debug("Monitored splitter produced {} splits over {} samples", splits.size(), monitored.length);
    return splits;
  }
}
