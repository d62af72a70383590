package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.Split;
import ca.gc.cra.tracesplit.domain.split.SplitInvariantException;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import ca.gc.cra.tracesplit.domain.trace.TransportProtocol;
import java.util.BitSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Checks constructed splits against the partition invariants.
 * <p><strong>Why:</strong> A broken partition leaks samples between training and evaluation; every split is
 * verified before anything is written and a failure aborts the run.</p>
 * <p><strong>Role:</strong> Called by {@link TraceSplitter} and {@link UnmonitoredSplitter}.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class SplitInvariants {

  private SplitInvariants() {
    // Utility
  }

  /**
   * Verifies an assembled split.
   *
   * <ul>
   *   <li>partitions are free of duplicates and pairwise disjoint;</li>
   *   <li>every index belongs to the universe;</li>
   *   <li>train and validation hold TCP samples only;</li>
   *   <li>no unmonitored group spans two partitions;</li>
   *   <li>every monitored class appears in train, test, and validation when {@code expectValidation}.</li>
   * </ul>
   *
   * @param table label table
   * @param repetition repetition number for diagnostics
   * @param split split to check
   * @param universe indices the split may draw from
   * @param monitoredClasses classes that must be covered
   * @param expectValidation whether the validation partition must cover every class
   * @throws SplitInvariantException on the first violated invariant
   */
  public static void requireValid(
      LabelTable table,
      int repetition,
      Split split,
      int[] universe,
      SortedSet<Integer> monitoredClasses,
      boolean expectValidation) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(split, "split");
    Objects.requireNonNull(universe, "universe");
    Objects.requireNonNull(monitoredClasses, "monitoredClasses");
    int[] train = split.train();
    int[] validation = split.validation();
    int[] test = split.test();

    if (!IndexSets.distinct(IndexSets.concat(train, validation, test))) {
      throw new SplitInvariantException(repetition, "partitions overlap or repeat an index (train/val "
          + IndexSets.overlap(train, validation) + ", train/test " + IndexSets.overlap(train, test)
          + ", val/test " + IndexSets.overlap(validation, test) + " shared)");
    }

    BitSet allowed = IndexSets.toBitSet(universe);
    for (int index : IndexSets.concat(train, validation, test)) {
      if (!allowed.get(index)) {
        throw new SplitInvariantException(repetition, "index " + index + " is outside the sample universe");
      }
    }

    requireTcpOnly(table, repetition, train, "train");
    requireTcpOnly(table, repetition, validation, "validation");
    requireGroupIsolation(table, repetition, train, validation, test);

    requireClassCoverage(table, repetition, train, monitoredClasses, "train");
    requireClassCoverage(table, repetition, test, monitoredClasses, "test");
    if (expectValidation) {
      requireClassCoverage(table, repetition, validation, monitoredClasses, "validation");
    }
  }

  /**
   * Verifies the protocol make-up of a test partition.
   *
   * <p>Without mixing, or with {@code quicFraction == 0}, the test set is TCP only. With {@code quicFraction == 1}
   * it holds no TCP sample.</p>
   *
   * @param table label table
   * @param repetition repetition number for diagnostics
   * @param test test partition
   * @param mixed whether QUIC mixing was requested
   * @param quicFraction requested QUIC share
   * @param population population name for diagnostics
   * @throws SplitInvariantException if the protocol mix is inconsistent with the request
   */
  public static void requireTestMixture(
      LabelTable table, int repetition, int[] test, boolean mixed, double quicFraction, String population) {
    if (!mixed || quicFraction <= 0.0) {
      requireTcpOnly(table, repetition, test, population + " test");
      return;
    }
    if (quicFraction >= 1.0) {
      for (int index : test) {
        if (table.isTcp(index)) {
          throw new SplitInvariantException(repetition,
              population + " test contains TCP sample " + index + " although quicFraction is 1");
        }
      }
    }
  }

  /**
   * Verifies the protocol post-conditions of an unmonitored split.
   *
   * @param table label table
   * @param repetition repetition number for diagnostics
   * @param split unmonitored split
   * @param withQuic whether QUIC groups were mixed into the test set
   * @param quicFraction requested QUIC share of test groups
   * @throws SplitInvariantException if a post-condition fails
   */
  public static void requireUnmonitoredProtocols(
      LabelTable table, int repetition, Split split, boolean withQuic, double quicFraction) {
    Set<TransportProtocol> trainProtocols = protocols(table, split.train());
    if (!trainProtocols.equals(Set.of(TransportProtocol.TCP))) {
      throw new SplitInvariantException(repetition,
          "unmonitored train protocols must be exactly {tcp} but were " + trainProtocols);
    }
    requireTcpOnly(table, repetition, split.validation(), "unmonitored validation");
    requireTestMixture(table, repetition, split.test(), withQuic, quicFraction, "unmonitored");
    if (withQuic && quicFraction > 0.0 && quicFraction < 1.0) {
      Set<TransportProtocol> testProtocols = protocols(table, split.test());
      if (testProtocols.size() < 2) {
        throw new SplitInvariantException(repetition,
            "unmonitored test set should mix protocols but only holds " + testProtocols);
      }
    }
  }

  private static void requireTcpOnly(LabelTable table, int repetition, int[] indices, String partition) {
    for (int index : indices) {
      if (!table.isTcp(index)) {
        throw new SplitInvariantException(repetition, partition + " contains non-TCP sample " + index
            + " (" + table.protocolOf(index) + ")");
      }
    }
  }

  private static void requireGroupIsolation(
      LabelTable table, int repetition, int[] train, int[] validation, int[] test) {
    Set<Integer> trainGroups = unmonitoredGroups(table, train);
    Set<Integer> validationGroups = unmonitoredGroups(table, validation);
    Set<Integer> testGroups = unmonitoredGroups(table, test);
    requireNoSharedGroup(repetition, trainGroups, validationGroups, "train", "validation");
    requireNoSharedGroup(repetition, trainGroups, testGroups, "train", "test");
    requireNoSharedGroup(repetition, validationGroups, testGroups, "validation", "test");
  }

  private static void requireNoSharedGroup(
      int repetition, Set<Integer> left, Set<Integer> right, String leftName, String rightName) {
    Set<Integer> shared = new TreeSet<>(left);
    shared.retainAll(right);
    if (!shared.isEmpty()) {
      throw new SplitInvariantException(repetition, "unmonitored groups " + shared + " appear in both "
          + leftName + " and " + rightName);
    }
  }

  private static void requireClassCoverage(
      LabelTable table, int repetition, int[] indices, SortedSet<Integer> classes, String partition) {
    if (classes.isEmpty()) {
      return;
    }
    Set<Integer> present = new HashSet<>();
    for (int index : indices) {
      if (table.isMonitored(index)) {
        present.add(table.classOf(index));
      }
    }
    if (!present.containsAll(classes)) {
      SortedSet<Integer> missing = new TreeSet<>(classes);
      missing.removeAll(present);
      throw new SplitInvariantException(repetition, partition + " is missing monitored classes " + missing);
    }
  }

  private static Set<Integer> unmonitoredGroups(LabelTable table, int[] indices) {
    Set<Integer> groups = new HashSet<>();
    for (int index : indices) {
      if (!table.isMonitored(index)) {
        groups.add(table.groupOf(index));
      }
    }
    return groups;
  }

  private static Set<TransportProtocol> protocols(LabelTable table, int[] indices) {
    Set<TransportProtocol> protocols = new TreeSet<>();
    for (int index : indices) {
      protocols.add(table.protocolOf(index));
    }
    return protocols;
  }
}
