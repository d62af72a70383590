package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.Fractions;
import ca.gc.cra.tracesplit.domain.split.Holdout;
import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.split.StratumEncoder;
import ca.gc.cra.tracesplit.domain.split.StratumEncoder.Strata;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Single stratified holdout by class, used to carve validation sets out of TCP training candidates.
 *
 * <p>The held-out total is {@code ceil(fraction * n)}. It is apportioned across classes by largest remainder, ties
 * going to the lower class id. Every class must keep at least one sample on each side.</p>
 *
 * @since 0.1.0
 */
public final class StratifiedHoldout {

  private StratifiedHoldout() {
    // Utility
  }

  /**
   * Holds out a class-stratified share of the indices.
   *
   * @param table label table providing classes
   * @param indices candidate indices
   * @param heldOutFraction share to hold out, in {@code (0, 1)}
   * @param random random stream; one draw per class in ascending class order
   * @return ascending retained and held-out indices
   * @throws SplitConfigurationException if a class cannot keep a sample on both sides
   */
  public static Holdout split(LabelTable table, int[] indices, double heldOutFraction, SplitRandom random) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(indices, "indices");
    Objects.requireNonNull(random, "random");
    Strata strata = StratumEncoder.byClass(table, indices);
    List<int[]> members = strata.members();
    int[] allocation = allocate(members, Fractions.ceilCount(heldOutFraction, indices.length));

    List<int[]> held = new ArrayList<>(members.size());
    for (int code = 0; code < members.size(); code++) {
      int size = members.get(code).length;
      if (allocation[code] < 1 || allocation[code] >= size) {
        throw new SplitConfigurationException("class " + strata.key(code).classId() + " has " + size
            + " training samples; a validation fraction of " + heldOutFraction
            + " cannot leave at least one on each side");
      }
      held.add(random.choose(members.get(code), allocation[code]));
    }
    int[] heldOut = IndexSets.sorted(IndexSets.concat(held.toArray(new int[0][])));
    BitSet heldSet = IndexSets.toBitSet(heldOut);
    int[] retained = IndexSets.filter(IndexSets.sorted(indices), index -> !heldSet.get(index));
    return new Holdout(retained, heldOut);
  }

  static int[] allocate(List<int[]> members, int total) {
    int n = 0;
    for (int[] stratum : members) {
      n += stratum.length;
    }
    int[] allocation = new int[members.size()];
    double[] remainders = new double[members.size()];
    int assigned = 0;
    for (int code = 0; code < members.size(); code++) {
      double exact = n == 0 ? 0.0 : (double) total * members.get(code).length / n;
      allocation[code] = (int) Math.floor(exact + 1e-9);
      remainders[code] = exact - allocation[code];
      assigned += allocation[code];
    }
    List<Integer> order = new ArrayList<>(members.size());
    for (int code = 0; code < members.size(); code++) {
      order.add(code);
    }
    order.sort(Comparator.<Integer>comparingDouble(code -> remainders[code]).reversed()
        .thenComparingInt(code -> code));
    for (int i = 0; i < total - assigned && i < order.size(); i++) {
      allocation[order.get(i)]++;
    }
    return allocation;
  }
}
