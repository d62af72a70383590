package ca.gc.cra.tracesplit.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Loads a YAML configuration file into flat {@code key=value} pairs for one command.
 * <p><strong>Layout:</strong> Keys under {@code common} apply to every command; keys under the command's own section
 * ({@code split}, {@code describe}) are applied afterwards and win. Nested mappings flatten to dotted keys, so
 * {@code otel: {endpoint: x}} becomes {@code otel.endpoint=x}.</p>
 * <p><strong>Safety:</strong> Only plain YAML types are constructed and duplicate keys are rejected.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";
  private static final int MAX_ALIASES = 20;

  private YamlConfigLoader() {}

  /**
   * Loads and flattens the sections relevant to {@code mode}.
   *
   * @param path YAML file
   * @param mode command name
   * @return flattened settings, or empty when the file does not exist
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the document is not valid YAML or uses unsupported structures
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String section = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = newYaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = mapping(document, "document");
    Map<String, String> flattened = new LinkedHashMap<>();
    flattenSection(sections, COMMON_SECTION, flattened);
    flattenSection(sections, section, flattened);
    return Optional.of(Map.copyOf(flattened));
  }

  private static Yaml newYaml() {
    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    options.setMaxAliasesForCollections(MAX_ALIASES);
    return new Yaml(new SafeConstructor(options));
  }

  private static void flattenSection(Map<String, Object> sections, String name, Map<String, String> target) {
    // Section names are matched case-insensitively; keys inside them are not.
    sections.forEach((key, value) -> {
      if (key.trim().toLowerCase(Locale.ROOT).equals(name) && value != null) {
        flatten(mapping(value, name), "", target);
      }
    });
  }

  private static void flatten(Map<String, Object> node, String prefix, Map<String, String> target) {
    node.forEach((key, value) -> {
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains a blank key under '" + prefix + "'");
      }
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?>) {
        flatten(mapping(value, dotted), dotted, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported (key " + dotted + ")");
      } else {
        target.put(dotted, value == null ? "" : value.toString());
      }
    });
  }

  private static Map<String, Object> mapping(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("YAML " + context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name)) {
        throw new IllegalArgumentException("YAML " + context + " has a non-string key: " + key);
      }
      map.put(name, value);
    });
    return map;
  }
}
