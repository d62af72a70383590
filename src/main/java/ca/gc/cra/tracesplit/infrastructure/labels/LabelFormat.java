package ca.gc.cra.tracesplit.infrastructure.labels;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Label store formats understood by {@link LabelStoreReaders}.
 *
 * @since 0.1.0
 */
public enum LabelFormat {
  /** Pick by file extension. */
  AUTO,
  /** HDF5 compound dataset. */
  HDF5,
  /** Newline-delimited JSON. */
  NDJSON;

  /**
   * Parses a configuration value.
   *
   * @param raw {@code auto}, {@code hdf5} or {@code ndjson}, case-insensitive
   * @return format
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static LabelFormat parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return AUTO;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "auto" -> AUTO;
      case "hdf5", "h5" -> HDF5;
      case "ndjson", "jsonl" -> NDJSON;
      default -> throw new IllegalArgumentException("format must be auto, hdf5 or ndjson (was " + raw + ")");
    };
  }

  /**
   * Resolves {@link #AUTO} against a file name.
   *
   * @param path label file
   * @return {@link #HDF5} for {@code .h5}, {@code .hdf}, {@code .hdf5}; {@link #NDJSON} otherwise; other formats
   *     resolve to themselves
   */
  public LabelFormat resolve(Path path) {
    if (this != AUTO) {
      return this;
    }
    Path fileName = path.getFileName();
    String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".h5") || name.endsWith(".hdf") || name.endsWith(".hdf5")) {
      return HDF5;
    }
    return NDJSON;
  }
}
