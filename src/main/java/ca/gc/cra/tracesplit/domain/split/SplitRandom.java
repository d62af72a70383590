package ca.gc.cra.tracesplit.domain.split;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * <strong>What:</strong> Seeded random source threaded explicitly through every splitting step.
 * <p><strong>Why:</strong> A run must be reproducible from one seed; there is no global random state, and each
 * component receives its own stream via {@link #fork()} in a fixed order.</p>
 * <p><strong>Role:</strong> Domain utility owned by the split orchestrator and handed down to splitters.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine each instance to one thread.</p>
 * <p><strong>Performance:</strong> Wraps {@link SplittableRandom}; shuffles are in-place Fisher-Yates.</p>
 *
 * @since 0.1.0
 */
public final class SplitRandom {
  private final SplittableRandom random;

  private SplitRandom(SplittableRandom random) {
    this.random = random;
  }

  /**
   * Creates the root generator for a run.
   *
   * @param seed run seed
   * @return generator
   */
  public static SplitRandom seeded(long seed) {
    return new SplitRandom(new SplittableRandom(seed));
  }

  /**
   * Derives an independent child stream, advancing this generator.
   *
   * @return child generator
   */
  public SplitRandom fork() {
    return new SplitRandom(random.split());
  }

  /**
   * Returns a uniform integer in {@code [0, bound)}.
   *
   * @param bound exclusive upper bound; must be positive
   * @return random integer
   */
  public int nextInt(int bound) {
    return random.nextInt(bound);
  }

  /**
   * Shuffles the array in place.
   *
   * @param values array to permute
   */
  public void shuffle(int[] values) {
    Objects.requireNonNull(values, "values");
    for (int i = values.length - 1; i > 0; i--) {
      int j = random.nextInt(i + 1);
      int tmp = values[i];
      values[i] = values[j];
      values[j] = tmp;
    }
  }

  /**
   * Returns a random permutation of {@code [0, n)}.
   *
   * @param n permutation length
   * @return permutation
   */
  public int[] permutation(int n) {
    int[] values = new int[n];
    for (int i = 0; i < n; i++) {
      values[i] = i;
    }
    shuffle(values);
    return values;
  }

  /**
   * Draws {@code k} distinct values from {@code pool} without replacement, in draw order.
   *
   * @param pool candidates; not modified
   * @param k number of values to draw
   * @return drawn values
   * @throws IllegalArgumentException if {@code k} is negative or exceeds the pool size
   */
  public int[] choose(int[] pool, int k) {
    Objects.requireNonNull(pool, "pool");
    if (k < 0 || k > pool.length) {
      throw new IllegalArgumentException("cannot draw " + k + " values from a pool of " + pool.length);
    }
    int[] copy = pool.clone();
    for (int i = 0; i < k; i++) {
      int j = i + random.nextInt(copy.length - i);
      int tmp = copy[i];
      copy[i] = copy[j];
      copy[j] = tmp;
    }
    int[] drawn = new int[k];
    System.arraycopy(copy, 0, drawn, 0, k);
    return drawn;
  }
}
