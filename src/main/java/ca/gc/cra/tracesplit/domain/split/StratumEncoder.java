package ca.gc.cra.tracesplit.domain.split;

import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import ca.gc.cra.tracesplit.domain.trace.TransportProtocol;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.IntFunction;

/**
 * <strong>What:</strong> Maps stratification keys to dense integer codes through an explicit ordered bijection.
 * <p><strong>Why:</strong> Stratified splitters need genuine category labels; deriving codes from sorted unique
 * keys (class first, then protocol tag) keeps them identical across runs regardless of row order.</p>
 * <p><strong>Role:</strong> Domain service used by the monitored splitter, validation holdout, and protocol mixer.</p>
 * <p><strong>Thread-safety:</strong> Stateless; returned {@link Strata} are immutable.</p>
 * <p><strong>Performance:</strong> O(n log k) for {@code n} indices and {@code k} distinct keys.</p>
 *
 * @since 0.1.0
 */
public final class StratumEncoder {

  private StratumEncoder() {
    // Utility
  }

  /**
   * Encodes each index by its {@code (class, protocol)} pair.
   *
   * @param table label table
   * @param indices indices to encode
   * @return codes parallel to {@code indices}
   */
  public static Strata byClassAndProtocol(LabelTable table, int[] indices) {
    Objects.requireNonNull(table, "table");
    return encode(indices, index -> new StratumKey(table.classOf(index), table.protocolOf(index)));
  }

  /**
   * Encodes each index by its class alone.
   *
   * @param table label table
   * @param indices indices to encode
   * @return codes parallel to {@code indices}
   */
  public static Strata byClass(LabelTable table, int[] indices) {
    Objects.requireNonNull(table, "table");
    return encode(indices, index -> StratumKey.ofClass(table.classOf(index)));
  }

  private static Strata encode(int[] indices, IntFunction<StratumKey> keyOf) {
    Objects.requireNonNull(indices, "indices");
    StratumKey[] keys = new StratumKey[indices.length];
    TreeMap<StratumKey, Integer> codes = new TreeMap<>();
    for (int i = 0; i < indices.length; i++) {
      keys[i] = keyOf.apply(indices[i]);
      codes.put(keys[i], 0);
    }
    int next = 0;
    for (Map.Entry<StratumKey, Integer> entry : codes.entrySet()) {
      entry.setValue(next++);
    }
    int[] encoded = new int[indices.length];
    for (int i = 0; i < indices.length; i++) {
      encoded[i] = codes.get(keys[i]);
    }
    return new Strata(indices.clone(), encoded, List.copyOf(codes.keySet()));
  }

  /**
   * Stratification key. {@code protocol} is {@code null} when stratifying by class alone.
   *
   * @param classId class id
   * @param protocol protocol, or {@code null}
   */
  public record StratumKey(int classId, TransportProtocol protocol) implements Comparable<StratumKey> {
    private static final Comparator<StratumKey> ORDER = Comparator
        .comparingInt(StratumKey::classId)
        .thenComparing(StratumKey::protocol, Comparator.nullsFirst(Comparator.naturalOrder()));

    static StratumKey ofClass(int classId) {
      return new StratumKey(classId, null);
    }

    @Override
    public int compareTo(StratumKey other) {
      return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
      return protocol == null
          ? "(class=" + classId + ")"
          : "(class=" + classId + ", protocol=" + protocol + ")";
    }
  }

  /**
   * Encoded strata for an index array.
   *
   * <p>{@code codes[i]} is the stratum of {@code indices[i]}; {@code keys.get(code)} decodes a code.</p>
   */
  public static final class Strata {
    private final int[] indices;
    private final int[] codes;
    private final List<StratumKey> keys;

    private Strata(int[] indices, int[] codes, List<StratumKey> keys) {
      this.indices = indices;
      this.codes = codes;
      this.keys = keys;
    }

    /**
     * Returns the number of distinct strata.
     *
     * @return stratum count
     */
    int count() {
      return keys.size();
    }

    /**
     * Returns the encoded indices.
     *
     * @return copy of the indices, in input order
     */
    public int[] indices() {
      return indices.clone();
    }

    /**
     * Returns the code of each index.
     *
     * @return copy of the codes parallel to {@link #indices()}
     */
    int[] codes() {
      return codes.clone();
    }

    /**
     * Decodes a stratum code.
     *
     * @param code code in {@code [0, count)}
     * @return key for the code
     */
    public StratumKey key(int code) {
      return keys.get(code);
    }

    /**
     * Returns the keys ordered by code.
     *
     * @return unmodifiable key list
     */
    List<StratumKey> keys() {
      return keys;
    }

    /**
     * Groups the indices by stratum.
     *
     * @return members per code, each list ascending by position in the input
     */
    public List<int[]> members() {
      int[] sizes = new int[keys.size()];
      for (int code : codes) {
        sizes[code]++;
      }
      List<int[]> members = new ArrayList<>(keys.size());
      for (int size : sizes) {
        members.add(new int[size]);
      }
      int[] fill = new int[keys.size()];
      for (int i = 0; i < codes.length; i++) {
        members.get(codes[i])[fill[codes[i]]++] = indices[i];
      }
      return Collections.unmodifiableList(members);
    }
  }
}
