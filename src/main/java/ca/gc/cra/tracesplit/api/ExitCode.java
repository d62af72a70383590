package ca.gc.cra.tracesplit.api;

/**
 * <strong>What:</strong> Process exit codes shared by the tracesplit commands.
 * <p><strong>Why:</strong> Scripts driving experiments need to tell bad arguments, bad label stores, and failed
 * verification apart without parsing log output.</p>
 * <p><strong>Role:</strong> Returned by every CLI entry point; {@link Main#main(String[])} hands it to the JVM.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Output could not be written. */
  IO_ERROR(3),
  /** The parameters cannot be satisfied by the loaded labels. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** A constructed split broke a partition invariant; nothing was written. */
  INVARIANT_VIOLATION(6),
  /** The label store is missing or malformed. */
  INPUT_ERROR(7),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
