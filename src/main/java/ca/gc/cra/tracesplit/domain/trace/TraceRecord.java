package ca.gc.cra.tracesplit.domain.trace;

import java.util.Objects;

/**
 * <strong>What:</strong> Label metadata for a single network trace.
 * <p><strong>Role:</strong> Row view over {@link LabelTable}; produced on demand, never stored by the splitters.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param index stable position of the trace in the backing store
 * @param classId class id in {@code [0, C)} for monitored traces, {@link #UNMONITORED} otherwise
 * @param group negative site id ({@code -(site+1)}) for unmonitored traces; {@code 0} for monitored traces
 * @param protocol transport protocol of the trace
 * @param region vantage point that collected the trace
 * @since 0.1.0
 */
public record TraceRecord(
    int index,
    int classId,
    int group,
    TransportProtocol protocol,
    String region) {
  /** Class id sentinel for open-world (unmonitored) traces. */
  public static final int UNMONITORED = -1;

  /**
   * Validates the row.
   *
   * @throws IllegalArgumentException if the index is negative or the class id is below {@link #UNMONITORED}
   */
  public TraceRecord {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0 (was " + index + ")");
    }
    if (classId < UNMONITORED) {
      throw new IllegalArgumentException("class must be >= -1 (was " + classId + ")");
    }
    Objects.requireNonNull(protocol, "protocol");
    Objects.requireNonNull(region, "region");
  }

  /**
   * Indicates whether the trace belongs to the closed-world set.
   *
   * @return {@code true} when the class id is not the unmonitored sentinel
   */
  public boolean monitored() {
    return classId != UNMONITORED;
  }
}
