package ca.gc.cra.tracesplit.config;

import ca.gc.cra.tracesplit.infrastructure.labels.LabelFormat;
import ca.gc.cra.tracesplit.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Location and format of a label store.
 *
 * @param input label file
 * @param format configured format; {@link LabelFormat#AUTO} resolves by extension
 * @param dataset HDF5 dataset path
 * @since 0.1.0
 */
public record LabelSource(Path input, LabelFormat format, String dataset) {
  /** Default HDF5 dataset path. */
  public static final String DEFAULT_DATASET = "labels";

  /**
   * Normalizes and validates the components.
   *
   * @throws IllegalArgumentException if the dataset path is malformed
   */
  public LabelSource {
    input = Objects.requireNonNull(input, "input").toAbsolutePath().normalize();
    format = Objects.requireNonNullElse(format, LabelFormat.AUTO);
    dataset = Strings.requireDatasetPath("dataset", Objects.requireNonNullElse(dataset, DEFAULT_DATASET));
  }

  /**
   * Reads {@code in}, {@code format} and {@code dataset} from flat options.
   *
   * @param options effective configuration
   * @return label source
   * @throws IllegalArgumentException if {@code in} is missing or a value is invalid
   */
  public static LabelSource fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = Strings.requireNonBlank("in", Objects.requireNonNullElse(options.get("in"), ""));
    Path input;
    try {
      input = Path.of(in);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("in must be a valid path: " + ex.getMessage(), ex);
    }
    String dataset = options.get("dataset");
    return new LabelSource(
        input,
        LabelFormat.parse(options.get("format")),
        dataset == null || dataset.isBlank() ? DEFAULT_DATASET : dataset);
  }

  /**
   * Format after resolving {@link LabelFormat#AUTO} against the file name.
   *
   * @return concrete format
   */
  public LabelFormat effectiveFormat() {
    return format.resolve(input);
  }
}
