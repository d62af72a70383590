package ca.gc.cra.tracesplit.infrastructure.labels;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracesplit.application.port.LabelStoreException;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class Hdf5LabelStoreReaderTest {
  @TempDir Path tempDir;

  @Test
  void convertsNarrowAndWideIntegerColumns() throws Exception {
    Map<String, Object> columns = new LinkedHashMap<>();
    columns.put("class", new byte[] {0, -1});
    columns.put("group", new long[] {0L, -5L});
    columns.put("protocol", new String[] {"tcp", "quic"});
    columns.put("region", new String[] {"toronto", "frankfurt"});

    LabelTable table = Hdf5LabelStoreReader.fromColumns(columns, "hdf5:test#labels");

    assertEquals(2, table.size());
    assertEquals(-5, table.groupOf(1));
    assertEquals("frankfurt", table.regionOf(1));
  }

  @Test
  void reportsMissingColumn() {
    Map<String, Object> columns = new LinkedHashMap<>();
    columns.put("class", new int[] {0});
    columns.put("group", new int[] {0});
    columns.put("protocol", new String[] {"tcp"});

    LabelStoreException ex = assertThrows(LabelStoreException.class,
        () -> Hdf5LabelStoreReader.fromColumns(columns, "hdf5:test#labels"));
    assertTrue(ex.getMessage().contains("missing column 'region'"));
  }

  @Test
  void rejectsWrongColumnTypeAndOutOfRangeValues() {
    Map<String, Object> textClass = new LinkedHashMap<>();
    textClass.put("class", new String[] {"0"});
    textClass.put("group", new int[] {0});
    textClass.put("protocol", new String[] {"tcp"});
    textClass.put("region", new String[] {"r"});
    assertThrows(LabelStoreException.class, () -> Hdf5LabelStoreReader.fromColumns(textClass, "src"));

    Map<String, Object> wide = new LinkedHashMap<>(textClass);
    wide.put("class", new long[] {1L << 40});
    LabelStoreException ex = assertThrows(LabelStoreException.class,
        () -> Hdf5LabelStoreReader.fromColumns(wide, "src"));
    assertTrue(ex.getMessage().contains("out of int range"));
  }

  @Test
  void missingFileIsAnInputError() {
    Hdf5LabelStoreReader reader = new Hdf5LabelStoreReader(tempDir.resolve("absent.h5"), "labels");

    assertThrows(LabelStoreException.class, reader::read);
    assertEquals("hdf5:" + tempDir.resolve("absent.h5") + "#labels", reader.describe());
  }
}
