package ca.gc.cra.tracesplit.domain.split;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Train, validation, and test index sets for one repetition of one population
 * (monitored or unmonitored).
 * <p><strong>Role:</strong> Output of the monitored and unmonitored splitters; input of the assembler.</p>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are copied on the way in and on the way out.</p>
 *
 * @param train training indices
 * @param validation validation indices; empty when no validation fraction is configured
 * @param test test indices
 * @since 0.1.0
 */
public record Split(int[] train, int[] validation, int[] test) {

  /**
   * Copies the index arrays.
   */
  public Split {
    train = Objects.requireNonNull(train, "train").clone();
    validation = Objects.requireNonNull(validation, "validation").clone();
    test = Objects.requireNonNull(test, "test").clone();
  }

  /**
   * Returns a split with no indices.
   *
   * @return empty split
   */
  public static Split empty() {
    return new Split(IndexSets.empty(), IndexSets.empty(), IndexSets.empty());
  }

  @Override
  public int[] train() {
    return train.clone();
  }

  @Override
  public int[] validation() {
    return validation.clone();
  }

  @Override
  public int[] test() {
    return test.clone();
  }

  /**
   * Total number of indices across the three partitions.
   *
   * @return combined size
   */
  public int size() {
    return train.length + validation.length + test.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Split that)) {
      return false;
    }
    return Arrays.equals(train, that.train)
        && Arrays.equals(validation, that.validation)
        && Arrays.equals(test, that.test);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(train);
    result = 31 * result + Arrays.hashCode(validation);
    result = 31 * result + Arrays.hashCode(test);
    return result;
  }

  @Override
  public String toString() {
    return "Split{train=" + train.length
        + ", validation=" + validation.length
        + ", test=" + test.length + '}';
  }
}
