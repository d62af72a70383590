package ca.gc.cra.tracesplit.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Embedded defaults per command, expressed as flat {@code key=value} pairs so they merge with YAML and CLI input.
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a command.
   *
   * @param mode {@code split} or {@code describe}
   * @return immutable defaults
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "split" -> buildSplitDefaults();
      case "describe" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("format", "auto");
    map.put("dataset", LabelSource.DEFAULT_DATASET);
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return map;
  }

  private static Map<String, String> buildSplitDefaults() {
    SplitConfig defaults = SplitConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", SplitConfig.STDOUT);
    map.put("nSplits", Integer.toString(defaults.nSplits()));
    map.put("nRepeats", Integer.toString(defaults.nRepeats()));
    map.put("validationFraction", Double.toString(defaults.validationFraction()));
    map.put("withMonitoredQuic", Boolean.toString(defaults.withMonitoredQuic()));
    map.put("withUnmonitoredQuic", Boolean.toString(defaults.withUnmonitoredQuic()));
    map.put("quicFraction", Double.toString(defaults.quicFraction()));
    map.put("seed", Long.toString(defaults.seed()));
    map.put("tracesPerClass", Integer.toString(defaults.tracesPerClass()));
    map.put("nClasses", Integer.toString(defaults.nClasses()));
    return map;
  }
}
