package ca.gc.cra.tracesplit.domain.trace;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Aggregate counts describing a {@link LabelTable}, used by the {@code describe} command and startup logs.
 *
 * @param samples total number of traces
 * @param monitoredSamples traces with a class id
 * @param unmonitoredSamples traces labelled {@code -1}
 * @param samplesPerProtocol trace count per protocol tag
 * @param monitoredClasses number of distinct class ids
 * @param minimumPerClassAndProtocol smallest (class, protocol) population among monitored traces; {@code 0} when
 *     some class lacks a protocol that other classes have
 * @param unmonitoredGroups number of distinct unmonitored groups
 * @param regions distinct regions
 * @since 0.1.0
 */
public record LabelSummary(
    int samples,
    int monitoredSamples,
    int unmonitoredSamples,
    SortedMap<String, Integer> samplesPerProtocol,
    int monitoredClasses,
    int minimumPerClassAndProtocol,
    int unmonitoredGroups,
    SortedSet<String> regions) {

  /**
   * Copies the collections.
   */
  public LabelSummary {
    samplesPerProtocol = new TreeMap<>(Objects.requireNonNull(samplesPerProtocol, "samplesPerProtocol"));
    regions = new TreeSet<>(Objects.requireNonNull(regions, "regions"));
  }

  /**
   * Computes the summary in a single pass over the table.
   *
   * @param table label table
   * @return summary
   */
  public static LabelSummary of(LabelTable table) {
    Objects.requireNonNull(table, "table");
    int monitored = 0;
    SortedMap<String, Integer> perProtocol = new TreeMap<>();
    Set<Integer> classes = new HashSet<>();
    Set<String> monitoredProtocols = new HashSet<>();
    Map<Long, Integer> perClassProtocol = new HashMap<>();
    Map<String, Integer> protocolCodes = new HashMap<>();
    Set<Integer> groups = new HashSet<>();
    SortedSet<String> regions = new TreeSet<>();
    for (int i = 0; i < table.size(); i++) {
      String tag = table.protocolOf(i).tag();
      perProtocol.merge(tag, 1, Integer::sum);
      regions.add(table.regionOf(i));
      if (table.isMonitored(i)) {
        monitored++;
        classes.add(table.classOf(i));
        monitoredProtocols.add(tag);
        int code = protocolCodes.computeIfAbsent(tag, t -> protocolCodes.size());
        long key = ((long) table.classOf(i) << 32) | code;
        perClassProtocol.merge(key, 1, Integer::sum);
      } else {
        groups.add(table.groupOf(i));
      }
    }
    int minimum = 0;
    if (!classes.isEmpty()) {
      boolean complete = perClassProtocol.size() == classes.size() * monitoredProtocols.size();
      minimum = complete
          ? perClassProtocol.values().stream().mapToInt(Integer::intValue).min().orElse(0)
          : 0;
    }
    return new LabelSummary(
        table.size(),
        monitored,
        table.size() - monitored,
        perProtocol,
        classes.size(),
        minimum,
        groups.size(),
        regions);
  }
}
