package ca.gc.cra.tracesplit.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String checks for configuration values.
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern DATASET_SEGMENT = Pattern.compile("^[A-Za-z0-9._-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Trims a value and rejects blank or control-character input.
   *
   * @param name parameter name used in error messages
   * @param value candidate value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an HDF5 dataset path such as {@code labels} or {@code /traces/labels}.
   *
   * @param name parameter name used in error messages
   * @param value candidate path
   * @return trimmed path
   * @throws IllegalArgumentException if a segment is empty or holds characters other than letters, digits, dot,
   *     underscore, or hyphen
   */
  public static String requireDatasetPath(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    String relative = trimmed.startsWith("/") ? trimmed.substring(1) : trimmed;
    if (relative.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must name a dataset"));
    }
    for (String segment : relative.split("/", -1)) {
      if (!DATASET_SEGMENT.matcher(segment).matches()) {
        throw new IllegalArgumentException(message(name,
            "segments must only contain letters, digits, dot, underscore, or hyphen"));
      }
    }
    return trimmed;
  }

  /**
   * Validates a printable ASCII value of bounded length.
   *
   * @param name parameter name used in error messages
   * @param value candidate value
   * @param maxLength maximum accepted length
   * @return trimmed value
   * @throws IllegalArgumentException if too long or containing non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
