package ca.gc.cra.tracesplit.domain.split;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Set operations over {@code int[]} index arrays.
 *
 * <p>Inputs are never modified. Results preserve the order of the first operand unless stated otherwise.</p>
 *
 * @since 0.1.0
 */
public final class IndexSets {
  private static final int[] EMPTY = new int[0];

  private IndexSets() {
    // Utility
  }

  /**
   * Returns a shared empty array.
   *
   * @return empty array; callers must not write to it
   */
  public static int[] empty() {
    return EMPTY;
  }

  /**
   * Concatenates arrays in argument order.
   *
   * @param parts arrays to join
   * @return concatenation
   */
  public static int[] concat(int[]... parts) {
    int total = 0;
    for (int[] part : parts) {
      total += part.length;
    }
    int[] joined = new int[total];
    int offset = 0;
    for (int[] part : parts) {
      System.arraycopy(part, 0, joined, offset, part.length);
      offset += part.length;
    }
    return joined;
  }

  /**
   * Keeps the values matching a predicate.
   *
   * @param values candidate values
   * @param predicate filter
   * @return matching values in input order
   */
  public static int[] filter(int[] values, IntPredicate predicate) {
    Objects.requireNonNull(predicate, "predicate");
    int[] buffer = new int[values.length];
    int count = 0;
    for (int value : values) {
      if (predicate.test(value)) {
        buffer[count++] = value;
      }
    }
    return count == values.length ? buffer : Arrays.copyOf(buffer, count);
  }

  /**
   * Returns the sorted distinct values.
   *
   * @param values input values
   * @return ascending unique values
   */
  public static int[] uniqueSorted(int[] values) {
    return Arrays.stream(values).distinct().sorted().toArray();
  }

  /**
   * Returns a sorted copy.
   *
   * @param values input values
   * @return ascending copy
   */
  public static int[] sorted(int[] values) {
    int[] copy = values.clone();
    Arrays.sort(copy);
    return copy;
  }

  /**
   * Reorders values by a permutation.
   *
   * @param values values to reorder
   * @param permutation positions into {@code values}; same length
   * @return {@code values[permutation[i]]} for each {@code i}
   */
  public static int[] permute(int[] values, int[] permutation) {
    if (values.length != permutation.length) {
      throw new IllegalArgumentException("permutation length " + permutation.length
          + " does not match " + values.length + " values");
    }
    int[] result = new int[values.length];
    for (int i = 0; i < permutation.length; i++) {
      result[i] = values[permutation[i]];
    }
    return result;
  }

  /**
   * Builds a membership bitmap for non-negative values.
   *
   * @param values members
   * @return bitmap with a bit set per member
   */
  public static BitSet toBitSet(int[] values) {
    BitSet bits = new BitSet();
    for (int value : values) {
      bits.set(value);
    }
    return bits;
  }

  /**
   * Returns the number of values present in both arrays (non-negative values only).
   *
   * @param left first array
   * @param right second array
   * @return overlap count
   */
  public static int overlap(int[] left, int[] right) {
    BitSet members = toBitSet(left);
    int count = 0;
    for (int value : right) {
      if (members.get(value)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Checks for repeated values.
   *
   * @param values values to inspect (non-negative)
   * @return {@code true} when every value occurs once
   */
  public static boolean distinct(int[] values) {
    BitSet seen = new BitSet();
    for (int value : values) {
      if (seen.get(value)) {
        return false;
      }
      seen.set(value);
    }
    return true;
  }
}
