package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.Fractions;
import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.split.StratumEncoder;
import ca.gc.cra.tracesplit.domain.split.StratumEncoder.Strata;
import ca.gc.cra.tracesplit.domain.split.StratumEncoder.StratumKey;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Subsamples a test set so that its QUIC share approaches a target fraction.
 * <p><strong>Role:</strong> Used by the monitored splitter when QUIC test traffic is enabled.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep {@code 1 - q} of every TCP {@code (class, protocol)} group and {@code q} of every other group.</li>
 *   <li>Keep whole groups at fraction 1 and drop them at fraction 0.</li>
 *   <li>Shuffle the kept indices before returning them.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ProtocolMixer {
  private static final Logger log = LoggerFactory.getLogger(ProtocolMixer.class);

  /**
   * Mixes candidates towards the requested QUIC fraction.
   *
   * @param table label table providing classes and protocols
   * @param candidates test candidates
   * @param quicFraction target QUIC share in {@code [0, 1]}
   * @param random random stream; one draw per group in stratum order, then one shuffle
   * @return shuffled subset of {@code candidates}
   * @throws ca.gc.cra.tracesplit.domain.split.SplitConfigurationException if {@code quicFraction} is outside
   *     {@code [0, 1]}
   */
  public int[] mix(LabelTable table, int[] candidates, double quicFraction, SplitRandom random) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(candidates, "candidates");
    Objects.requireNonNull(random, "random");
    Fractions.requireUnitInterval("quicFraction", quicFraction);

    Strata strata = StratumEncoder.byClassAndProtocol(table, candidates);
    List<int[]> members = strata.members();
    List<int[]> kept = new ArrayList<>(members.size());
    for (int code = 0; code < members.size(); code++) {
      StratumKey key = strata.key(code);
      double fraction = key.protocol().isTcp() ? 1.0 - quicFraction : quicFraction;
      kept.add(keep(members.get(code), fraction, random));
    }
    int[] mixed = IndexSets.concat(kept.toArray(new int[0][]));
    random.shuffle(mixed);
    if (log.isDebugEnabled()) {
      log.debug("Protocol mixer kept {} of {} candidates across {} groups (quicFraction={})",
          mixed.length, candidates.length, members.size(), quicFraction);
    }
    return mixed;
  }

  private static int[] keep(int[] group, double fraction, SplitRandom random) {
    if (fraction >= 1.0) {
      return group.clone();
    }
    if (fraction <= 0.0) {
      return IndexSets.empty();
    }
    int count = Math.min(group.length, Fractions.roundHalfUpCount(fraction, group.length));
    return random.choose(group, count);
  }
}
