package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.Holdout;
import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.split.StratumEncoder.Strata;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Repeated stratified k-fold partitioning.
 * <p><strong>Why:</strong> Every fold must preserve the relative frequency of each stratum, so each stratum is
 * shuffled and dealt round-robin across the folds.</p>
 * <p><strong>Role:</strong> Core of the monitored splitter.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject strata that cannot place a sample in every fold.</li>
 *   <li>Emit {@code nRepeats * nSplits} holdouts, repeat-major, each fold held out exactly once per repeat.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; the caller supplies the random stream.</p>
 * <p><strong>Performance:</strong> O(n) per repeat plus O(n) per emitted fold.</p>
 *
 * @implNote Dealing continues from the fold where the previous stratum stopped, so fold sizes differ by at most one
 * overall as well as within each stratum.
 * @since 0.1.0
 */
public final class StratifiedKFold {
  private final int nSplits;
  private final int nRepeats;

  /**
   * Creates the partitioner.
   *
   * @param nSplits folds per repeat; at least 2
   * @param nRepeats repeats; at least 1
   * @throws SplitConfigurationException if the counts are out of range
   */
  public StratifiedKFold(int nSplits, int nRepeats) {
    if (nSplits < 2) {
      throw new SplitConfigurationException("nSplits must be at least 2 (was " + nSplits + ")");
    }
    if (nRepeats < 1) {
      throw new SplitConfigurationException("nRepeats must be at least 1 (was " + nRepeats + ")");
    }
    this.nSplits = nSplits;
    this.nRepeats = nRepeats;
  }

  /**
   * Partitions the encoded indices.
   *
   * @param strata indices with their stratum codes
   * @param random random stream consumed once per stratum per repeat
   * @return holdouts where {@code heldOut} is the fold's test candidate and {@code retained} the remainder
   * @throws SplitConfigurationException if any stratum has fewer than {@code nSplits} members
   */
  public List<Holdout> split(Strata strata, SplitRandom random) {
    Objects.requireNonNull(strata, "strata");
    Objects.requireNonNull(random, "random");
    List<int[]> members = strata.members();
    for (int code = 0; code < members.size(); code++) {
      int size = members.get(code).length;
      if (size < nSplits) {
        throw new SplitConfigurationException("stratum " + strata.key(code) + " has " + size
            + " samples but " + nSplits + " folds need at least " + nSplits);
      }
    }

    int[] universe = IndexSets.sorted(strata.indices());
    List<Holdout> folds = new ArrayList<>(nSplits * nRepeats);
    for (int repeat = 0; repeat < nRepeats; repeat++) {
      int[][] byFold = deal(members, random);
      for (int fold = 0; fold < nSplits; fold++) {
        int[] test = IndexSets.sorted(byFold[fold]);
        BitSet held = IndexSets.toBitSet(test);
        int[] retained = IndexSets.filter(universe, index -> !held.get(index));
        folds.add(new Holdout(retained, test));
      }
    }
    return folds;
  }

  private int[][] deal(List<int[]> members, SplitRandom random) {
    int[] sizes = new int[nSplits];
    int offset = 0;
    for (int[] stratum : members) {
      for (int j = 0; j < stratum.length; j++) {
        sizes[(offset + j) % nSplits]++;
      }
      offset = (offset + stratum.length) % nSplits;
    }
    int[][] byFold = new int[nSplits][];
    for (int fold = 0; fold < nSplits; fold++) {
      byFold[fold] = new int[sizes[fold]];
    }
    int[] fill = new int[nSplits];
    offset = 0;
    for (int[] stratum : members) {
      int[] shuffled = stratum.clone();
      random.shuffle(shuffled);
      for (int j = 0; j < shuffled.length; j++) {
        int fold = (offset + j) % nSplits;
        byFold[fold][fill[fold]++] = shuffled[j];
      }
      offset = (offset + shuffled.length) % nSplits;
    }
    return byFold;
  }
}
