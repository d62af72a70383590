package ca.gc.cra.tracesplit.application.split;

import ca.gc.cra.tracesplit.domain.split.Fractions;
import ca.gc.cra.tracesplit.domain.split.SplitConfigurationException;

/**
 * <strong>What:</strong> Algorithmic parameters of a split run.
 * <p><strong>Role:</strong> Plain parameter record handed from the configuration layer to the splitters; carries no
 * I/O settings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param nSplits folds per repeat; at least 2
 * @param nRepeats k-fold repeats; at least 1
 * @param validationFraction share of the TCP training candidates held out for validation, in {@code [0, 1)}
 * @param withMonitoredQuic whether monitored test sets are passed through the protocol mixer
 * @param withUnmonitoredQuic whether unmonitored test sets mix QUIC groups in
 * @param quicFraction target QUIC share of mixed test sets, in {@code [0, 1]}
 * @param seed seed of the run's root random generator
 * @since 0.1.0
 */
public record SplitterSettings(
    int nSplits,
    int nRepeats,
    double validationFraction,
    boolean withMonitoredQuic,
    boolean withUnmonitoredQuic,
    double quicFraction,
    long seed) {

  /**
   * Validates parameter ranges.
   *
   * @throws SplitConfigurationException if a parameter is out of range
   */
  public SplitterSettings {
    if (nSplits < 2) {
      throw new SplitConfigurationException("nSplits must be at least 2 (was " + nSplits + ")");
    }
    if (nRepeats < 1) {
      throw new SplitConfigurationException("nRepeats must be at least 1 (was " + nRepeats + ")");
    }
    Fractions.requireUnitInterval("validationFraction", validationFraction);
    if (validationFraction >= 1.0) {
      throw new SplitConfigurationException("validationFraction must be below 1 (was " + validationFraction + ")");
    }
    Fractions.requireUnitInterval("quicFraction", quicFraction);
  }

  /**
   * Total number of split records a run emits.
   *
   * @return {@code nSplits * nRepeats}
   */
  public int repetitions() {
    return nSplits * nRepeats;
  }

  /**
   * Share of the data each repetition holds out for testing.
   *
   * @return {@code 1 / nSplits}
   */
  public double testFraction() {
    return 1.0 / nSplits;
  }

  /**
   * Indicates whether validation sets are carved out.
   *
   * @return {@code true} when {@code validationFraction > 0}
   */
  public boolean hasValidation() {
    return validationFraction > 0.0;
  }
}
