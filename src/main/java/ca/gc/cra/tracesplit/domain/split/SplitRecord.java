package ca.gc.cra.tracesplit.domain.split;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Final partition emitted for one repetition: monitored and unmonitored indices merged and
 * shuffled, plus the combined {@code train-val} permutation.
 * <p><strong>Why:</strong> External evaluation jobs select a repetition by line number and consume these arrays
 * verbatim; classifiers that do their own validation split read {@code train-val}.</p>
 * <p><strong>Role:</strong> Domain value written by {@code SplitRecordSink} implementations.</p>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are copied on construction and on access.</p>
 *
 * @param repetition zero-based repetition number ({@code repeat * nSplits + fold})
 * @param train training indices
 * @param validation validation indices
 * @param test test indices
 * @param trainValidation permutation of {@code train} followed by {@code validation}
 * @since 0.1.0
 */
public record SplitRecord(
    int repetition,
    int[] train,
    int[] validation,
    int[] test,
    int[] trainValidation) {

  /**
   * Copies the arrays and checks that {@code trainValidation} has the combined length.
   *
   * @throws IllegalArgumentException if the repetition is negative or {@code trainValidation} has the wrong length
   */
  public SplitRecord {
    if (repetition < 0) {
      throw new IllegalArgumentException("repetition must be >= 0 (was " + repetition + ")");
    }
    train = Objects.requireNonNull(train, "train").clone();
    validation = Objects.requireNonNull(validation, "validation").clone();
    test = Objects.requireNonNull(test, "test").clone();
    trainValidation = Objects.requireNonNull(trainValidation, "trainValidation").clone();
    if (trainValidation.length != train.length + validation.length) {
      throw new IllegalArgumentException("train-val must hold " + (train.length + validation.length)
          + " indices (was " + trainValidation.length + ")");
    }
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

  @Override
  public int[] trainValidation() {
    return trainValidation.clone();
  }

  /**
   * Drops the {@code train-val} view.
   *
   * @return the three partitions as a split
   */
  public Split asSplit() {
    return new Split(train, validation, test);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SplitRecord that)) {
      return false;
    }
    return repetition == that.repetition
        && Arrays.equals(train, that.train)
        && Arrays.equals(validation, that.validation)
        && Arrays.equals(test, that.test)
        && Arrays.equals(trainValidation, that.trainValidation);
  }

  @Override
  public int hashCode() {
    int result = Integer.hashCode(repetition);
    result = 31 * result + Arrays.hashCode(train);
    result = 31 * result + Arrays.hashCode(validation);
    result = 31 * result + Arrays.hashCode(test);
    result = 31 * result + Arrays.hashCode(trainValidation);
    return result;
  }

  @Override
  public String toString() {
    return "SplitRecord{repetition=" + repetition
        + ", train=" + train.length
        + ", validation=" + validation.length
        + ", test=" + test.length + '}';
  }
}
