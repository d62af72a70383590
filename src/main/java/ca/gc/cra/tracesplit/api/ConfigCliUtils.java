package ca.gc.cra.tracesplit.api;

import ca.gc.cra.tracesplit.config.ConfigMerger;
import ca.gc.cra.tracesplit.config.DefaultsForMode;
import ca.gc.cra.tracesplit.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for layering command-line arguments over YAML and embedded defaults.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    return parseBoolean(map, key, false);
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      default -> false;
    };
  }

  /**
   * Parses {@code key=value} arguments, loads the optional YAML file, and merges both over the defaults.
   *
   * <p>Failures are logged here; callers only print their usage line and return the exit code.</p>
   *
   * @param mode command name, also the YAML section read next to {@code common}
   * @param input parsed command line
   * @param log logger of the calling command
   * @return effective configuration or the exit code to report
   */
  static Resolution resolve(String mode, CliInput input, Logger log) {
    for (String flag : input.unknownFlags()) {
      log.warn("Ignoring unknown flag {}", flag);
    }
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }

    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return Resolution.failed(ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      return new Resolution(effective, null);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Outcome of {@link #resolve(String, CliInput, Logger)}.
   *
   * @param effective merged configuration; {@code null} on failure
   * @param failure exit code to report; {@code null} on success
   */
  record Resolution(Map<String, String> effective, ExitCode failure) {
    static Resolution failed(ExitCode failure) {
      return new Resolution(null, failure);
    }

    boolean isFailure() {
      return failure != null;
    }
  }
}
