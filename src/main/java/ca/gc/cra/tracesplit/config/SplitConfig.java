package ca.gc.cra.tracesplit.config;

import ca.gc.cra.tracesplit.application.split.SplitterSettings;
import ca.gc.cra.tracesplit.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed configuration of the {@code split} command.
 * <p><strong>Why:</strong> Centralizes range checks so invalid settings fail before the label store is opened.</p>
 * <p><strong>Role:</strong> Built from merged flat options by {@link #fromMap(Map)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param source label store location and format
 * @param output output file, or empty for stdout
 * @param nSplits folds per repeat, 2..1000
 * @param nRepeats repeats, 1..1000
 * @param validationFraction validation share in {@code [0, 1)}
 * @param withMonitoredQuic mix QUIC into monitored test sets
 * @param withUnmonitoredQuic mix QUIC into unmonitored test sets
 * @param quicFraction QUIC share in {@code [0, 1]}
 * @param seed generator seed
 * @param tracesPerClass trace selection budget; {@code 0} disables selection
 * @param nClasses classes kept after selection; {@code 0} keeps all valid classes
 * @since 0.1.0
 */
public record SplitConfig(
    LabelSource source,
    Optional<Path> output,
    int nSplits,
    int nRepeats,
    double validationFraction,
    boolean withMonitoredQuic,
    boolean withUnmonitoredQuic,
    double quicFraction,
    long seed,
    int tracesPerClass,
    int nClasses) {

  /** Output value selecting standard output. */
  public static final String STDOUT = "-";

  /**
   * Validates ranges.
   *
   * @throws IllegalArgumentException if a value is out of range
   */
  public SplitConfig {
    Objects.requireNonNull(source, "source");
    output = Objects.requireNonNullElse(output, Optional.empty());
    Numbers.requireRange("nSplits", nSplits, 2, 1000);
    Numbers.requireRange("nRepeats", nRepeats, 1, 1000);
    Numbers.requireFraction("validationFraction", validationFraction, false);
    Numbers.requireFraction("quicFraction", quicFraction, true);
    Numbers.requireRange("tracesPerClass", tracesPerClass, 0, Integer.MAX_VALUE);
    Numbers.requireRange("nClasses", nClasses, 0, Integer.MAX_VALUE);
    if (nClasses > 0 && tracesPerClass == 0) {
      throw new IllegalArgumentException("nClasses requires tracesPerClass > 0");
    }
  }

  /**
   * Returns the defaults with a placeholder input of {@code labels.h5}.
   *
   * @return default configuration
   */
  public static SplitConfig defaults() {
    return new SplitConfig(
        new LabelSource(Path.of("labels.h5"), null, LabelSource.DEFAULT_DATASET),
        Optional.empty(),
        10,
        2,
        0.1,
        false,
        false,
        0.5,
        16248L,
        0,
        0);
  }

  /**
   * Builds a configuration from flat options, falling back to {@link #defaults()} for absent keys.
   *
   * @param options effective configuration
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing, malformed, or out of range
   */
  public static SplitConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SplitConfig defaults = defaults();
    return new SplitConfig(
        LabelSource.fromMap(options),
        parseOutput(options.get("out")),
        parseInt(options, "nSplits", defaults.nSplits()),
        parseInt(options, "nRepeats", defaults.nRepeats()),
        parseDouble(options, "validationFraction", defaults.validationFraction()),
        parseBoolean(options, "withMonitoredQuic", defaults.withMonitoredQuic()),
        parseBoolean(options, "withUnmonitoredQuic", defaults.withUnmonitoredQuic()),
        parseDouble(options, "quicFraction", defaults.quicFraction()),
        parseLong(options, "seed", defaults.seed()),
        parseInt(options, "tracesPerClass", defaults.tracesPerClass()),
        parseInt(options, "nClasses", defaults.nClasses()));
  }

  /**
   * Projects the algorithmic parameters.
   *
   * @return splitter settings
   */
  public SplitterSettings toSettings() {
    return new SplitterSettings(
        nSplits, nRepeats, validationFraction, withMonitoredQuic, withUnmonitoredQuic, quicFraction, seed);
  }

  /**
   * Describes the output destination.
   *
   * @return output path or {@code "stdout"}
   */
  public String outputDescription() {
    return output.map(Path::toString).orElse("stdout");
  }

  private static Optional<Path> parseOutput(String raw) {
    if (raw == null || raw.isBlank() || STDOUT.equals(raw.trim())) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(raw.trim()).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("out must be a valid path: " + ex.getMessage(), ex);
    }
  }

  private static int parseInt(Map<String, String> options, String key, int defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static long parseLong(Map<String, String> options, String key, long defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static double parseDouble(Map<String, String> options, String key, double defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was " + raw + ")", ex);
    }
  }

  private static boolean parseBoolean(Map<String, String> options, String key, boolean defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
    };
  }
}
