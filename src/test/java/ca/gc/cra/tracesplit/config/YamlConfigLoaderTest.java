package ca.gc.cra.tracesplit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void mergesCommonAndModeSections() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("tracesplit.yaml"), String.join("\n",
        "common:",
        "  in: labels.h5",
        "  dataset: /traces/labels",
        "split:",
        "  nSplits: 5",
        "  withMonitoredQuic: true",
        "describe:",
        "  format: hdf5",
        ""));

    Optional<Map<String, String>> loaded = YamlConfigLoader.load(yaml, "split");

    assertTrue(loaded.isPresent());
    Map<String, String> values = loaded.get();
    assertEquals("labels.h5", values.get("in"));
    assertEquals("/traces/labels", values.get("dataset"));
    assertEquals("5", values.get("nSplits"));
    assertEquals("true", values.get("withMonitoredQuic"));
    assertFalse(values.containsKey("format"));
  }

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("c.yaml"), "common:\n  seed: 1\nsplit:\n  seed: 2\n");

    assertEquals("2", YamlConfigLoader.load(yaml, "split").orElseThrow().get("seed"));
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "split").isEmpty());
  }

  @Test
  void rejectsArraysAndMalformedYaml() throws IOException {
    Path arrays = Files.writeString(tempDir.resolve("arrays.yaml"), "split:\n  seeds: [1, 2]\n");
    Path malformed = Files.writeString(tempDir.resolve("bad.yaml"), "split: [unterminated\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(arrays, "split"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(malformed, "split"));
  }

  @Test
  void rejectsDuplicateKeys() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("dup.yaml"), "split:\n  seed: 1\n  seed: 2\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "split"));
  }

  @Test
  void nestedKeysFlattenWithDots() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("nested.yaml"),
        "common:\n  otel:\n    endpoint: http://collector:4317\n");

    assertEquals("http://collector:4317",
        YamlConfigLoader.load(yaml, "describe").orElseThrow().get("otel.endpoint"));
  }
}
