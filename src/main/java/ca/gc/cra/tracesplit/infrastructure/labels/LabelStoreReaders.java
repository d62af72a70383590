package ca.gc.cra.tracesplit.infrastructure.labels;

import ca.gc.cra.tracesplit.application.port.LabelStoreReader;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Creates the reader matching a configured label format.
 *
 * @since 0.1.0
 */
public final class LabelStoreReaders {

  private LabelStoreReaders() {
    // Utility
  }

  /**
   * Opens a reader for the given store.
   *
   * @param path label file
   * @param format configured format; {@link LabelFormat#AUTO} resolves by extension
   * @param datasetPath HDF5 dataset path, ignored for NDJSON
   * @return reader
   */
  public static LabelStoreReader forPath(Path path, LabelFormat format, String datasetPath) {
    Objects.requireNonNull(path, "path");
    return switch (Objects.requireNonNull(format, "format").resolve(path)) {
      case HDF5 -> new Hdf5LabelStoreReader(path, datasetPath);
      case NDJSON, AUTO -> new NdjsonLabelStoreReader(path);
    };
  }
}
