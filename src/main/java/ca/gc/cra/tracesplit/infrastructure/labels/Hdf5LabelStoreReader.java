package ca.gc.cra.tracesplit.infrastructure.labels;

import ca.gc.cra.tracesplit.application.port.LabelStoreException;
import ca.gc.cra.tracesplit.application.port.LabelStoreReader;
import ca.gc.cra.tracesplit.domain.trace.LabelTable;
import io.jhdf.HdfFile;
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.jhdf.exceptions.HdfException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads labels from an HDF5 file with the pure-Java jHDF library.
 * <p><strong>Layouts:</strong> Either a compound dataset whose members are {@code class}, {@code group},
 * {@code protocol} and {@code region}, or a group holding one 1-D dataset per column under those names.</p>
 * <p><strong>Thread-safety:</strong> Single use.</p>
 *
 * @since 0.1.0
 */
public final class Hdf5LabelStoreReader implements LabelStoreReader {
  private static final Logger log = LoggerFactory.getLogger(Hdf5LabelStoreReader.class);
  static final String[] COLUMNS = {"class", "group", "protocol", "region"};

  private final Path path;
  private final String datasetPath;

  /**
   * Creates a reader.
   *
   * @param path HDF5 file
   * @param datasetPath path of the label dataset or group inside the file
   */
  public Hdf5LabelStoreReader(Path path, String datasetPath) {
    this.path = Objects.requireNonNull(path, "path");
    this.datasetPath = Objects.requireNonNull(datasetPath, "datasetPath");
  }

  @Override
  public LabelTable read() throws LabelStoreException {
    if (!Files.isRegularFile(path)) {
      throw new LabelStoreException("label file not found: " + path);
    }
    Map<String, Object> columns;
    try (HdfFile file = new HdfFile(path)) {
      Node node = file.getByPath(datasetPath);
      columns = readColumns(node);
    } catch (HdfException ex) {
      throw new LabelStoreException("failed to read '" + datasetPath + "' from " + path + ": " + ex.getMessage(), ex);
    }
    log.debug("Read HDF5 columns {} from {}#{}", columns.keySet(), path, datasetPath);
    return fromColumns(columns, describe());
  }

  private Map<String, Object> readColumns(Node node) throws LabelStoreException {
    if (node instanceof Dataset dataset) {
      Object data = dataset.getData();
      if (!(data instanceof Map<?, ?> compound)) {
        throw new LabelStoreException("dataset '" + datasetPath + "' in " + path + " is not a compound dataset");
      }
      Map<String, Object> columns = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : compound.entrySet()) {
        columns.put(String.valueOf(entry.getKey()), entry.getValue());
      }
      return columns;
    }
    if (node instanceof Group group) {
      Map<String, Object> columns = new LinkedHashMap<>();
      for (String column : COLUMNS) {
        Node child = group.getChild(column);
        if (child instanceof Dataset dataset) {
          columns.put(column, dataset.getData());
        }
      }
      return columns;
    }
    throw new LabelStoreException("'" + datasetPath + "' in " + path + " is neither a dataset nor a group");
  }

  /**
   * Converts raw column arrays into a validated label table.
   *
   * @param columns column name to array ({@code int[]}, {@code long[]}, {@code short[]}, {@code byte[]} for numbers,
   *     {@code String[]} for text)
   * @param source source description for error messages
   * @return label table
   * @throws LabelStoreException if a column is missing, has an unsupported type, or a row fails validation
   */
  static LabelTable fromColumns(Map<String, Object> columns, String source) throws LabelStoreException {
    for (String column : COLUMNS) {
      if (!columns.containsKey(column)) {
        throw new LabelStoreException(source + ": missing column '" + column + "' (found " + columns.keySet() + ")");
      }
    }
    int[] classes = intColumn(columns.get("class"), "class", source);
    int[] groups = intColumn(columns.get("group"), "group", source);
    String[] protocols = textColumn(columns.get("protocol"), "protocol", source);
    String[] regions = textColumn(columns.get("region"), "region", source);
    try {
      return LabelTable.of(classes, groups, protocols, regions);
    } catch (IllegalArgumentException ex) {
      throw new LabelStoreException(source + ": " + ex.getMessage(), ex);
    }
  }

  private static int[] intColumn(Object raw, String name, String source) throws LabelStoreException {
    if (raw instanceof int[] ints) {
      return ints;
    }
    if (raw instanceof long[] longs) {
      int[] values = new int[longs.length];
      for (int i = 0; i < longs.length; i++) {
        if (longs[i] < Integer.MIN_VALUE || longs[i] > Integer.MAX_VALUE) {
          throw new LabelStoreException(source + ": row " + i + ": column '" + name + "' value " + longs[i]
              + " is out of int range");
        }
        values[i] = (int) longs[i];
      }
      return values;
    }
    if (raw instanceof short[] shorts) {
      int[] values = new int[shorts.length];
      for (int i = 0; i < shorts.length; i++) {
        values[i] = shorts[i];
      }
      return values;
    }
    if (raw instanceof byte[] bytes) {
      int[] values = new int[bytes.length];
      for (int i = 0; i < bytes.length; i++) {
        values[i] = bytes[i];
      }
      return values;
    }
    throw new LabelStoreException(source + ": column '" + name + "' must be an integer array but was "
        + typeName(raw));
  }

  private static String[] textColumn(Object raw, String name, String source) throws LabelStoreException {
    if (raw instanceof String[] strings) {
      return strings;
    }
    throw new LabelStoreException(source + ": column '" + name + "' must be a string array but was "
        + typeName(raw));
  }

  private static String typeName(Object raw) {
    return raw == null ? "null" : raw.getClass().getSimpleName();
  }

  @Override
  public String describe() {
    return "hdf5:" + path + "#" + datasetPath;
  }
}
