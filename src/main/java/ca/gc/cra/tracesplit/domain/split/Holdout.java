package ca.gc.cra.tracesplit.domain.split;

import java.util.Arrays;
import java.util.Objects;

/**
 * Two-way partition of a candidate index set: the indices kept and the indices held out.
 *
 * <p>Produced by k-fold, group shuffle-split, and stratified holdout; both arrays are ascending.</p>
 *
 * @param retained indices that stay on the training side
 * @param heldOut indices moved to the held-out side
 * @since 0.1.0
 */
public record Holdout(int[] retained, int[] heldOut) {

  /**
   * Copies the arrays.
   */
  public Holdout {
    retained = Objects.requireNonNull(retained, "retained").clone();
    heldOut = Objects.requireNonNull(heldOut, "heldOut").clone();
  }

  @Override
  public int[] retained() {
    return retained.clone();
  }

  @Override
  public int[] heldOut() {
    return heldOut.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Holdout that)) {
      return false;
    }
    return Arrays.equals(retained, that.retained) && Arrays.equals(heldOut, that.heldOut);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(retained) + Arrays.hashCode(heldOut);
  }

  @Override
  public String toString() {
    return "Holdout{retained=" + retained.length + ", heldOut=" + heldOut.length + '}';
  }
}
