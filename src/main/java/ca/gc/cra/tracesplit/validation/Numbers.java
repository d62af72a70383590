package ca.gc.cra.tracesplit.validation;

/**
 * <strong>What:</strong> Numeric range checks for configuration values.
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name parameter name used in the error message
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if the value is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures a fraction lies within {@code [0, 1]}, or {@code [0, 1)} when {@code allowOne} is false.
   *
   * @param name parameter name used in the error message
   * @param value candidate fraction
   * @param allowOne whether {@code 1.0} is accepted
   * @return {@code value}
   * @throws IllegalArgumentException if the value is NaN or out of range
   */
  public static double requireFraction(String name, double value, boolean allowOne) {
    boolean tooHigh = allowOne ? value > 1.0 : value >= 1.0;
    if (Double.isNaN(value) || value < 0.0 || tooHigh) {
      throw new IllegalArgumentException(
          label(name) + " must be within [0, 1" + (allowOne ? "]" : ")") + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
