package ca.gc.cra.tracesplit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracesplit.application.split.SplitterSettings;
import ca.gc.cra.tracesplit.infrastructure.labels.LabelFormat;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SplitConfigTest {

  @Test
  void parsesEveryKey() {
    Map<String, String> options = new HashMap<>();
    options.put("in", "labels.ndjson");
    options.put("out", "splits.ndjson");
    options.put("nSplits", "5");
    options.put("nRepeats", "3");
    options.put("validationFraction", "0.2");
    options.put("withMonitoredQuic", "yes");
    options.put("withUnmonitoredQuic", "1");
    options.put("quicFraction", "0.25");
    options.put("seed", "99");
    options.put("tracesPerClass", "100");
    options.put("nClasses", "10");

    SplitConfig config = SplitConfig.fromMap(options);

    assertEquals(LabelFormat.NDJSON, config.source().effectiveFormat());
    assertEquals(Path.of("splits.ndjson").toAbsolutePath().normalize(), config.output().orElseThrow());
    SplitterSettings settings = config.toSettings();
    assertEquals(5, settings.nSplits());
    assertEquals(3, settings.nRepeats());
    assertEquals(0.2, settings.validationFraction());
    assertTrue(settings.withMonitoredQuic());
    assertTrue(settings.withUnmonitoredQuic());
    assertEquals(0.25, settings.quicFraction());
    assertEquals(99L, settings.seed());
    assertEquals(100, config.tracesPerClass());
    assertEquals(10, config.nClasses());
  }

  @Test
  void dashSelectsStdoutAndAbsentKeysUseDefaults() {
    SplitConfig config = SplitConfig.fromMap(Map.of("in", "labels.h5", "out", "-"));

    assertTrue(config.output().isEmpty());
    assertEquals("stdout", config.outputDescription());
    assertEquals(SplitConfig.defaults().seed(), config.seed());
    assertEquals(LabelFormat.HDF5, config.source().effectiveFormat());
    assertEquals("labels", config.source().dataset());
  }

  @Test
  void rejectsOutOfRangeAndMalformedValues() {
    assertThrows(IllegalArgumentException.class,
        () -> SplitConfig.fromMap(Map.of("in", "l.h5", "nSplits", "1")));
    assertThrows(IllegalArgumentException.class,
        () -> SplitConfig.fromMap(Map.of("in", "l.h5", "validationFraction", "1.0")));
    assertThrows(IllegalArgumentException.class,
        () -> SplitConfig.fromMap(Map.of("in", "l.h5", "quicFraction", "abc")));
    assertThrows(IllegalArgumentException.class,
        () -> SplitConfig.fromMap(Map.of("in", "l.h5", "withMonitoredQuic", "maybe")));
    assertThrows(IllegalArgumentException.class,
        () -> SplitConfig.fromMap(Map.of("in", "l.h5", "dataset", "bad path")));
    assertThrows(IllegalArgumentException.class, () -> SplitConfig.fromMap(Map.of("out", "x")));
  }
}
