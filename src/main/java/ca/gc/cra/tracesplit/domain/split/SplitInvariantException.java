package ca.gc.cra.tracesplit.domain.split;

/**
 * Raised when a constructed split breaks a partition invariant (overlap, group leakage, non-TCP training data,
 * missing class). Indicates a logic bug; the run must abort before any record is written.
 *
 * @since 0.1.0
 */
public final class SplitInvariantException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final int repetition;

  /**
   * Creates an exception for a repetition.
   *
   * @param repetition zero-based repetition number, {@code -1} when not tied to one
   * @param message violated invariant
   */
  public SplitInvariantException(int repetition, String message) {
    super(repetition < 0 ? message : "repetition " + repetition + ": " + message);
    this.repetition = repetition;
  }

  /**
   * Returns the repetition that failed.
   *
   * @return zero-based repetition number or {@code -1}
   */
  public int repetition() {
    return repetition;
  }
}
