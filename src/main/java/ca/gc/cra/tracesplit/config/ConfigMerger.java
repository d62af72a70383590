package ca.gc.cra.tracesplit.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges embedded defaults, YAML settings, and command-line arguments with CLI &gt; YAML &gt; defaults precedence.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration for a command.
   *
   * @param mode command name
   * @param yaml flattened YAML settings, if a file was supplied
   * @param cli command-line {@code key=value} pairs
   * @param defaults embedded defaults
   * @param warn receives a message for every CLI key overriding a YAML key; may be {@code null}
   * @return immutable effective configuration
   * @throws IllegalArgumentException if cross-key constraints fail
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (trim(effective.get("in")).isEmpty()) {
      throw new IllegalArgumentException("in is required for " + mode.toLowerCase(Locale.ROOT));
    }
    if (!"split".equalsIgnoreCase(mode)) {
      return;
    }
    int nClasses = parseInt(effective.get("nClasses"), "nClasses");
    int tracesPerClass = parseInt(effective.get("tracesPerClass"), "tracesPerClass");
    if (nClasses > 0 && tracesPerClass <= 0) {
      throw new IllegalArgumentException("nClasses requires tracesPerClass > 0");
    }
  }

  private static int parseInt(String value, String name) {
    String trimmed = trim(value);
    if (trimmed.isEmpty()) {
      return 0;
    }
    try {
      return Integer.parseInt(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was " + value + ")", ex);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
