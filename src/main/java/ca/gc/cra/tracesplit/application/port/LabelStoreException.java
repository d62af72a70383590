package ca.gc.cra.tracesplit.application.port;

/**
 * Checked exception thrown when a label store cannot be opened or holds malformed rows.
 *
 * @since 0.1.0
 */
public final class LabelStoreException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error, naming the offending row or column where known
   */
  public LabelStoreException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause from the file system or the format library
   */
  public LabelStoreException(String msg, Throwable cause) { super(msg, cause); }
}
