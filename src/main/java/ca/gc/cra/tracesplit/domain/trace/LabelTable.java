package ca.gc.cra.tracesplit.domain.trace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * <strong>What:</strong> In-memory columnar table of trace labels addressed by store index.
 * <p><strong>Why:</strong> Splitters scan class, group, and protocol columns many times per repetition; flat arrays
 * keep those scans cheap and avoid per-row allocation.</p>
 * <p><strong>Role:</strong> Domain aggregate produced by label store readers and consumed read-only by every
 * splitting component.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate column lengths and per-row label rules once at load time.</li>
 *   <li>Intern protocol tags and regions so equality checks stay identity-cheap.</li>
 *   <li>Select index subsets by predicate in ascending index order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; columns are private copies.</p>
 * <p><strong>Performance:</strong> O(1) column lookups; selections are O(n).</p>
 *
 * @since 0.1.0
 */
public final class LabelTable {
  private final int[] classes;
  private final int[] groups;
  private final TransportProtocol[] protocols;
  private final String[] regions;

  private LabelTable(int[] classes, int[] groups, TransportProtocol[] protocols, String[] regions) {
    this.classes = classes;
    this.groups = groups;
    this.protocols = protocols;
    this.regions = regions;
  }

  /**
   * Builds a table from parallel columns.
   *
   * @param classes class id per trace ({@code -1} for unmonitored)
   * @param groups group id per trace; must be negative for unmonitored traces
   * @param protocols protocol tag per trace
   * @param regions region per trace
   * @return validated table
   * @throws NullPointerException if a column is {@code null}
   * @throws IllegalArgumentException if column lengths differ or a row violates the label rules
   */
  public static LabelTable of(int[] classes, int[] groups, String[] protocols, String[] regions) {
    Objects.requireNonNull(classes, "classes");
    Objects.requireNonNull(groups, "groups");
    Objects.requireNonNull(protocols, "protocols");
    Objects.requireNonNull(regions, "regions");
    int n = classes.length;
    if (groups.length != n || protocols.length != n || regions.length != n) {
      throw new IllegalArgumentException("label columns must have equal length (class=" + n
          + ", group=" + groups.length + ", protocol=" + protocols.length
          + ", region=" + regions.length + ")");
    }
    Map<String, TransportProtocol> protocolPool = new HashMap<>();
    Map<String, String> regionPool = new HashMap<>();
    TransportProtocol[] protocolColumn = new TransportProtocol[n];
    String[] regionColumn = new String[n];
    for (int i = 0; i < n; i++) {
      validateRow(i, classes[i], groups[i], protocols[i], regions[i]);
      protocolColumn[i] = protocolPool.computeIfAbsent(protocols[i], TransportProtocol::of);
      String region = regions[i].trim();
      regionColumn[i] = regionPool.computeIfAbsent(region, r -> r);
    }
    return new LabelTable(classes.clone(), groups.clone(), protocolColumn, regionColumn);
  }

  /**
   * Starts a row-oriented builder.
   *
   * @return empty builder
   */
  public static Builder builder() {
    return new Builder();
  }

  private static void validateRow(int row, int classId, int group, String protocol, String region) {
    if (classId < TraceRecord.UNMONITORED) {
      throw new IllegalArgumentException("row " + row + ": class must be >= -1 (was " + classId + ")");
    }
    if (classId == TraceRecord.UNMONITORED && group >= 0) {
      throw new IllegalArgumentException(
          "row " + row + ": unmonitored traces require a negative group (was " + group + ")");
    }
    if (protocol == null || protocol.isBlank()) {
      throw new IllegalArgumentException("row " + row + ": protocol must not be blank");
    }
    if (region == null || region.isBlank()) {
      throw new IllegalArgumentException("row " + row + ": region must not be blank");
    }
  }

  /**
   * Returns the number of traces.
   *
   * @return row count
   */
  public int size() {
    return classes.length;
  }

  public int classOf(int index) {
    return classes[index];
  }

  public int groupOf(int index) {
    return groups[index];
  }

  public TransportProtocol protocolOf(int index) {
    return protocols[index];
  }

  public String regionOf(int index) {
    return regions[index];
  }

  public boolean isMonitored(int index) {
    return classes[index] != TraceRecord.UNMONITORED;
  }

  public boolean isTcp(int index) {
    return protocols[index].isTcp();
  }

  /**
   * Materializes a row view.
   *
   * @param index store index
   * @return trace record for the row
   * @throws IndexOutOfBoundsException if {@code index} is outside the table
   */
  public TraceRecord record(int index) {
    return new TraceRecord(index, classes[index], groups[index], protocols[index], regions[index]);
  }

  /**
   * Returns every store index in ascending order.
   *
   * @return {@code [0, size)}
   */
  public int[] allIndices() {
    int[] indices = new int[classes.length];
    Arrays.setAll(indices, i -> i);
    return indices;
  }

  /**
   * Selects the store indices matching a predicate, ascending.
   *
   * @param predicate index predicate
   * @return matching indices
   */
  public int[] select(IntPredicate predicate) {
    Objects.requireNonNull(predicate, "predicate");
    int[] buffer = new int[classes.length];
    int count = 0;
    for (int i = 0; i < classes.length; i++) {
      if (predicate.test(i)) {
        buffer[count++] = i;
      }
    }
    return Arrays.copyOf(buffer, count);
  }

  /**
   * Row-at-a-time builder used by streaming readers and tests.
   *
   * <p>Not thread-safe.</p>
   */
  public static final class Builder {
    private final List<Integer> classes = new ArrayList<>();
    private final List<Integer> groups = new ArrayList<>();
    private final List<String> protocols = new ArrayList<>();
    private final List<String> regions = new ArrayList<>();

    private Builder() {}

    /**
     * Appends a row; its store index is the number of rows added before it.
     *
     * @param classId class id ({@code -1} for unmonitored)
     * @param group group id
     * @param protocol protocol tag
     * @param region region name
     * @return this builder
     * @throws IllegalArgumentException if the row violates the label rules; the row is not appended
     */
    public Builder add(int classId, int group, String protocol, String region) {
      validateRow(size(), classId, group, protocol, region);
      classes.add(classId);
      groups.add(group);
      protocols.add(protocol);
      regions.add(region);
      return this;
    }

    /**
     * Returns the number of rows appended so far.
     *
     * @return row count
     */
    public int size() {
      return classes.size();
    }

    /**
     * Validates and freezes the rows.
     *
     * @return label table
     * @throws IllegalArgumentException if a row violates the label rules
     */
    public LabelTable build() {
      int[] classColumn = classes.stream().mapToInt(Integer::intValue).toArray();
      int[] groupColumn = groups.stream().mapToInt(Integer::intValue).toArray();
      return LabelTable.of(
          classColumn,
          groupColumn,
          protocols.toArray(String[]::new),
          regions.toArray(String[]::new));
    }
  }
}
