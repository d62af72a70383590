package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.IndexSets;
import ca.gc.cra.tracesplit.domain.split.Split;
import ca.gc.cra.tracesplit.domain.split.SplitRandom;
import ca.gc.cra.tracesplit.domain.split.SplitRecord;
import java.util.Objects;

/**
 * Merges the monitored and unmonitored split of one repetition into an output record.
 *
 * <p>Same-named partitions are concatenated and shuffled independently; {@code train-val} is a fresh permutation of
 * {@code train ++ validation}.</p>
 *
 * @since 0.1.0
 */
public final class SplitAssembler {

  /**
   * Assembles one record.
   *
   * @param repetition repetition number
   * @param monitored monitored split
   * @param unmonitored unmonitored split
   * @param random random stream; train, validation, test, and train-val are shuffled in that order
   * @return assembled record
   */
  public SplitRecord assemble(int repetition, Split monitored, Split unmonitored, SplitRandom random) {
    Objects.requireNonNull(monitored, "monitored");
    Objects.requireNonNull(unmonitored, "unmonitored");
    Objects.requireNonNull(random, "random");
    int[] train = IndexSets.concat(monitored.train(), unmonitored.train());
    int[] validation = IndexSets.concat(monitored.validation(), unmonitored.validation());
    int[] test = IndexSets.concat(monitored.test(), unmonitored.test());
    random.shuffle(train);
    random.shuffle(validation);
    random.shuffle(test);
    int[] joined = IndexSets.concat(train, validation);
    int[] trainValidation = IndexSets.permute(joined, random.permutation(joined.length));
    return new SplitRecord(repetition, train, validation, test, trainValidation);
  }
}
