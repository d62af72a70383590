package ca.gc.cra.tracesplit.infrastructure.labels;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class LabelFormatTest {

  @Test
  void parsesAliases() {
    assertEquals(LabelFormat.AUTO, LabelFormat.parse(null));
    assertEquals(LabelFormat.HDF5, LabelFormat.parse("H5"));
    assertEquals(LabelFormat.NDJSON, LabelFormat.parse("jsonl"));
    assertThrows(IllegalArgumentException.class, () -> LabelFormat.parse("csv"));
  }

  @Test
  void autoResolvesByExtension() {
    assertEquals(LabelFormat.HDF5, LabelFormat.AUTO.resolve(Path.of("data", "labels.HDF5")));
    assertEquals(LabelFormat.NDJSON, LabelFormat.AUTO.resolve(Path.of("labels.ndjson")));
    assertEquals(LabelFormat.HDF5, LabelFormat.HDF5.resolve(Path.of("labels.ndjson")));
  }

  @Test
  void readersFollowResolvedFormat() {
    assertInstanceOf(Hdf5LabelStoreReader.class,
        LabelStoreReaders.forPath(Path.of("labels.h5"), LabelFormat.AUTO, "labels"));
    assertInstanceOf(NdjsonLabelStoreReader.class,
        LabelStoreReaders.forPath(Path.of("labels.h5"), LabelFormat.NDJSON, "labels"));
  }
}
