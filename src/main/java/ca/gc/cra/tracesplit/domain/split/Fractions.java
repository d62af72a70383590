package ca.gc.cra.tracesplit.domain.split;

/**
 * Converts split fractions into element counts.
 *
 * @since 0.1.0
 */
public final class Fractions {
  /** Slack absorbing floating-point noise such as {@code 0.1 * 90 = 9.000000000000002}. */
  static final double TOLERANCE = 1e-9;

  private Fractions() {
    // Utility
  }

  /**
   * Number of elements a fraction of {@code n} claims, rounded up.
   *
   * @param fraction share in {@code [0, 1]}
   * @param n population size
   * @return {@code ceil(fraction * n)} with tolerance
   */
  public static int ceilCount(double fraction, int n) {
    return (int) Math.ceil(fraction * n - TOLERANCE);
  }

  /**
   * Number of elements a fraction of {@code n} claims, rounded half up.
   *
   * @param fraction share in {@code [0, 1]}
   * @param n population size
   * @return {@code floor(fraction * n + 0.5)} with tolerance
   */
  public static int roundHalfUpCount(double fraction, int n) {
    return (int) Math.floor(fraction * n + 0.5 + TOLERANCE);
  }

  /**
   * Validates a fraction against {@code [0, 1]}.
   *
   * @param name parameter name for diagnostics
   * @param fraction candidate value
   * @return the fraction
   * @throws SplitConfigurationException if the value is NaN or outside {@code [0, 1]}
   */
  public static double requireUnitInterval(String name, double fraction) {
    if (Double.isNaN(fraction) || fraction < 0.0 || fraction > 1.0) {
      throw new SplitConfigurationException(name + " must be within [0, 1] (was " + fraction + ")");
    }
    return fraction;
  }
}
