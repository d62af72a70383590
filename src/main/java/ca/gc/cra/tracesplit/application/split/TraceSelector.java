package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import ca.gc.cra.tracesplit.domain.trace.TransportProtocol;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Narrows the monitored population to a fixed trace budget per class before splitting.
 * <p><strong>Why:</strong> Collected datasets are uneven across regions and protocols; experiments need the same
 * number of traces for every class, spread evenly over protocols and regions.</p>
 * <p><strong>Role:</strong> Optional pre-stage of the split use case; disabled when {@code tracesPerClass == 0}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Draw per region, then per protocol, the traces of every class; the per-region quota is
 *       {@code ceil(tracesPerClass / regions / protocols)} over all monitored regions.</li>
 *   <li>Keep only classes that reach the full budget, optionally sampling {@code nClasses} of them.</li>
 *   <li>Pass every unmonitored sample through unchanged.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class TraceSelector {
  private static final Logger log = LoggerFactory.getLogger(TraceSelector.class);

  private final int tracesPerClass;
  private final int nClasses;

  /**
   * Creates a selector.
   *
   * @param tracesPerClass total traces per class across protocols; {@code 0} disables selection
   * @param nClasses number of classes to keep; {@code 0} keeps every valid class
   * @throws SplitConfigurationException if a parameter is negative or {@code nClasses} is set without a budget
   */
  public TraceSelector(int tracesPerClass, int nClasses) {
    if (tracesPerClass < 0) {
      throw new SplitConfigurationException("tracesPerClass must be non-negative (was " + tracesPerClass + ")");
    }
    if (nClasses < 0) {
      throw new SplitConfigurationException("nClasses must be non-negative (was " + nClasses + ")");
    }
    if (nClasses > 0 && tracesPerClass == 0) {
      throw new SplitConfigurationException("nClasses requires tracesPerClass > 0");
    }
    this.tracesPerClass = tracesPerClass;
    this.nClasses = nClasses;
  }

  /**
   * Indicates whether this selector changes the universe at all.
   *
   * @return {@code true} when a trace budget is configured
   */
  public boolean enabled() {
    return tracesPerClass > 0;
  }

  /**
   * Selects the sample universe.
   *
   * @param table label table
   * @param random random stream; unused when selection is disabled
   * @return ascending indices of the selected monitored traces and all unmonitored traces
   * @throws SplitConfigurationException if the budget does not divide across protocols or too few classes qualify
   */
  public int[] select(LabelTable table, SplitRandom random) {
    if (!enabled()) {
      return table.allIndices();
    }
    int[] monitored = table.select(table::isMonitored);
    SortedMap<TransportProtocol, SortedMap<Integer, SortedMap<String, List<Integer>>>> byProtocol =
        new TreeMap<>();
    Set<String> regions = new HashSet<>();
    for (int index : monitored) {
      regions.add(table.regionOf(index));
      byProtocol.computeIfAbsent(table.protocolOf(index), p -> new TreeMap<>())
          .computeIfAbsent(table.classOf(index), c -> new TreeMap<>())
          .computeIfAbsent(table.regionOf(index), r -> new ArrayList<>())
          .add(index);
    }
    if (byProtocol.isEmpty()) {
      throw new SplitConfigurationException("trace selection needs monitored samples but none were loaded");
    }
    int protocols = byProtocol.size();
    if (tracesPerClass % protocols != 0) {
      throw new SplitConfigurationException("tracesPerClass " + tracesPerClass
          + " is not divisible by the " + protocols + " monitored protocols " + byProtocol.keySet());
    }
    int perProtocol = tracesPerClass / protocols;
    // Quota is over all monitored regions, not only those a class was seen in.
    int divisor = regions.size() * protocols;
    int perRegion = (tracesPerClass + divisor - 1) / divisor;

    SortedMap<Integer, List<int[]>> selectedByClass = new TreeMap<>();
    for (Map.Entry<TransportProtocol, SortedMap<Integer, SortedMap<String, List<Integer>>>> protocol
        : byProtocol.entrySet()) {
      for (Map.Entry<Integer, SortedMap<String, List<Integer>>> byClass : protocol.getValue().entrySet()) {
        int[] drawn = drawClass(byClass.getValue(), perRegion, perProtocol, random);
        selectedByClass.computeIfAbsent(byClass.getKey(), c -> new ArrayList<>()).add(drawn);
      }
    }

    List<Integer> valid = new ArrayList<>();
    for (Map.Entry<Integer, List<int[]>> entry : selectedByClass.entrySet()) {
      int total = 0;
      for (int[] part : entry.getValue()) {
        total += part.length;
      }
      if (total == tracesPerClass) {
        valid.add(entry.getKey());
      }
    }
    log.info("Trace selection: {} of {} classes reached {} traces", valid.size(), selectedByClass.size(),
        tracesPerClass);

    int[] validClasses = valid.stream().mapToInt(Integer::intValue).toArray();
    int[] chosenClasses;
    if (nClasses > 0) {
      if (validClasses.length < nClasses) {
        throw new SplitConfigurationException("only " + validClasses.length + " of the requested " + nClasses
            + " classes have " + tracesPerClass + " traces");
      }
      chosenClasses = random.choose(validClasses, nClasses);
    } else {
      if (validClasses.length == 0) {
        throw new SplitConfigurationException("no class has " + tracesPerClass + " traces");
      }
      chosenClasses = validClasses;
    }

    List<int[]> parts = new ArrayList<>();
    for (int classId : IndexSets.sorted(chosenClasses)) {
      parts.addAll(selectedByClass.get(classId));
    }
    parts.add(table.select(index -> !table.isMonitored(index)));
    return IndexSets.sorted(IndexSets.concat(parts.toArray(new int[0][])));
  }

  private static int[] drawClass(
      SortedMap<String, List<Integer>> byRegion, int perRegion, int perProtocol, SplitRandom random) {
    List<int[]> pooled = new ArrayList<>(byRegion.size());
    for (List<Integer> region : byRegion.values()) {
      int[] traces = region.stream().mapToInt(Integer::intValue).toArray();
      pooled.add(traces.length >= perRegion ? random.choose(traces, perRegion) : IndexSets.empty());
    }
    int[] pool = IndexSets.concat(pooled.toArray(new int[0][]));
    return pool.length >= perProtocol ? random.choose(pool, perProtocol) : IndexSets.empty();
  }
}
