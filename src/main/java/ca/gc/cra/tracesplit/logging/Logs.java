package ca.gc.cra.tracesplit.logging;

/**
 * <strong>What:</strong> Formatting helpers that keep log lines bounded.
 * <p><strong>Why:</strong> Split partitions hold up to millions of indices; logging them whole would flood the
 * console.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Renders at most {@code maxItems} leading values of an index array.
   *
   * @param values array to render; {@code null} yields {@code "<null>"}
   * @param maxItems maximum number of values to print; must be positive
   * @return e.g. {@code "[4, 9, 1, ... (+97 more)]"}
   * @throws IllegalArgumentException if {@code maxItems} is not positive
   */
  public static String preview(int[] values, int maxItems) {
    if (maxItems <= 0) {
      throw new IllegalArgumentException("maxItems must be positive");
    }
    if (values == null) {
      return NULL_PLACEHOLDER;
    }
    int shown = Math.min(values.length, maxItems);
    StringBuilder sb = new StringBuilder(shown * 8 + 24).append('[');
    for (int i = 0; i < shown; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(values[i]);
    }
    if (values.length > shown) {
      sb.append(", ... (+").append(values.length - shown).append(" more)");
    }
    return sb.append(']').toString();
  }

  /**
   * Truncates a string to {@code maxChars} characters.
   *
   * @param value value to truncate; {@code null} yields {@code "<null>"}
   * @param maxChars maximum characters to keep; must be positive
   * @return original value when short enough, otherwise the prefix with a length marker
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars) + "... (truncated, " + maxChars + " of " + value.length() + ")";
  }
}
