package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.Holdout;
import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.Split;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Open-world splitter for unmonitored samples.
 * <p><strong>Why:</strong> Traces of one website must never be seen both in training and evaluation, so every
 * partitioning step shuffles whole groups.</p>
 * <p><strong>Role:</strong> Second stage of {@link TraceSplitter}; produces one split per repetition.</p>
 * <p><strong>Thread-safety:</strong> Immutable; callers supply the random stream.</p>
 *
 * @since 0.1.0
 */
public final class UnmonitoredSplitter {
  private static final Logger log = LoggerFactory.getLogger(UnmonitoredSplitter.class);

  private final SplitterSettings settings;

  /**
   * Creates the splitter.
   *
   * @param settings split parameters
   */
  public UnmonitoredSplitter(SplitterSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Splits the unmonitored part of the universe.
   *
   * @param table label table
   * @param universe candidate indices; monitored rows are ignored
   * @param random random stream; per repetition the test, validation, and QUIC group draws happen in that order
   * @return {@code nSplits * nRepeats} splits
   * @throws ca.gc.cra.tracesplit.domain.split.SplitConfigurationException if a partition would get no groups
   * @throws ca.gc.cra.tracesplit.domain.split.SplitInvariantException if a protocol post-condition fails
   */
  public List<Split> split(LabelTable table, int[] universe, SplitRandom random) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(universe, "universe");
    Objects.requireNonNull(random, "random");
    int[] unmonitored = IndexSets.filter(universe, index -> !table.isMonitored(index));
    if (unmonitored.length == 0) {
      log.warn("No unmonitored samples in the universe; unmonitored partitions will be empty");
      return Collections.nCopies(settings.repetitions(), Split.empty());
    }

    List<Split> splits = new ArrayList<>(settings.repetitions());
    for (int repetition = 0; repetition < settings.repetitions(); repetition++) {
      Holdout outer = GroupShuffleSplit.split(
          table, unmonitored, settings.testFraction(), random, "unmonitored test");
      int[] trainValidation = IndexSets.filter(outer.retained(), table::isTcp);
      int[] train = trainValidation;
      int[] validation = IndexSets.empty();
      if (settings.hasValidation()) {
        Holdout inner = GroupShuffleSplit.split(
            table, trainValidation, settings.validationFraction(), random, "unmonitored validation");
        train = inner.retained();
        validation = inner.heldOut();
      }
      int[] test = settings.withUnmonitoredQuic()
          ? mixGroups(table, outer.heldOut(), settings.quicFraction(), random)
          : IndexSets.filter(outer.heldOut(), table::isTcp);

      Split split = new Split(train, validation, test);
      SplitInvariants.requireUnmonitoredProtocols(
          table, repetition, split, settings.withUnmonitoredQuic(), settings.quicFraction());
      splits.add(split);
    }
    log.debug("Unmonitored splitter produced {} splits over {} samples", splits.size(), unmonitored.length);
    return splits;
  }

  private static int[] mixGroups(LabelTable table, int[] candidates, double quicFraction, SplitRandom random) {
    if (quicFraction <= 0.0) {
      return IndexSets.filter(candidates, table::isTcp);
    }
    if (quicFraction >= 1.0) {
      return IndexSets.filter(candidates, index -> !table.isTcp(index));
    }
    Holdout byGroup = GroupShuffleSplit.split(table, candidates, quicFraction, random, "unmonitored QUIC");
    int[] quic = IndexSets.filter(byGroup.heldOut(), index -> !table.isTcp(index));
    int[] tcp = IndexSets.filter(byGroup.retained(), table::isTcp);
    return IndexSets.sorted(IndexSets.concat(quic, tcp));
  }
}
