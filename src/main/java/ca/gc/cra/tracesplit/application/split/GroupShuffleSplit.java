package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.Fractions;
import ca.gc.cra.tracesplit.domain.split.Holdout;
import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Holds out a random share of <em>groups</em> rather than samples, so that all traces of one website land on the
 * same side.
 *
 * <p>The held-out side receives {@code ceil(fraction * groups)} groups. Both sides must end up with at least one
 * group.</p>
 *
 * @since 0.1.0
 */
public final class GroupShuffleSplit {

  private GroupShuffleSplit() {
    // Utility
  }

  /**
   * Splits indices by their group column.
   *
   * @param table label table providing groups
   * @param indices candidate indices
   * @param heldOutFraction share of groups to hold out, in {@code (0, 1)}
   * @param random random stream; one permutation of the distinct groups is drawn
   * @param purpose partition name used in error messages, e.g. {@code "unmonitored test"}
   * @return ascending retained and held-out indices
   * @throws SplitConfigurationException if either side would be left without groups
   */
  public static Holdout split(
      LabelTable table, int[] indices, double heldOutFraction, SplitRandom random, String purpose) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(indices, "indices");
    Objects.requireNonNull(random, "random");
    int[] groups = new int[indices.length];
    for (int i = 0; i < indices.length; i++) {
      groups[i] = table.groupOf(indices[i]);
    }
    int[] distinctGroups = IndexSets.uniqueSorted(groups);
    int heldCount = Fractions.ceilCount(heldOutFraction, distinctGroups.length);
    if (heldCount < 1) {
      throw new SplitConfigurationException("no groups available for the " + purpose + " partition ("
          + distinctGroups.length + " groups, fraction " + heldOutFraction + ")");
    }
    if (heldCount >= distinctGroups.length) {
      throw new SplitConfigurationException("holding out " + heldCount + " of " + distinctGroups.length
          + " groups for the " + purpose + " partition leaves none on the other side");
    }

    int[] permutation = random.permutation(distinctGroups.length);
    Set<Integer> held = new HashSet<>(heldCount * 2);
    for (int i = 0; i < heldCount; i++) {
      held.add(distinctGroups[permutation[i]]);
    }
    int[] sorted = IndexSets.sorted(indices);
    int[] heldOut = IndexSets.filter(sorted, index -> held.contains(table.groupOf(index)));
    int[] retained = IndexSets.filter(sorted, index -> !held.contains(table.groupOf(index)));
    return new Holdout(retained, heldOut);
  }
}
