package ca.gc.cra.tracesplit.validation;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> File path checks run before any input is read or output opened.
 * <p><strong>Why:</strong> Fails fast on unreadable inputs and refuses to clobber existing output by accident.</p>
 * <p><strong>Thread-safety:</strong> Stateless; results reflect the file system at call time.</p>
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures a path names an existing, readable regular file.
   *
   * @param name parameter name used in error messages
   * @param path candidate path
   * @return normalized absolute path
   * @throws IllegalArgumentException if the file is missing, a directory, or unreadable
   */
  public static Path validateReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Ensures a file can be created at {@code path}.
   *
   * @param name parameter name used in error messages
   * @param path candidate output file
   * @param allowOverwrite whether an existing regular file may be replaced
   * @return normalized absolute path
   * @throws IllegalArgumentException if the parent directory is missing or unwritable, the path is a directory, or
   *     the file exists and overwriting is not allowed
   */
  public static Path validateWritableFile(String name, Path path, boolean allowOverwrite) {
    Path normalized = normalize(name, path);
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (Files.isDirectory(normalized)) {
        throw new IllegalArgumentException(name + " is a directory: " + normalized);
      }
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            name + " " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException(name + " is not writable: " + normalized);
      }
      return normalized;
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
