package ca.gc.cra.tracesplit.domain.split;

/**
 * Raised when the label data cannot satisfy the requested split parameters, for example a stratum smaller than the
 * fold count or an empty group partition.
 *
 * <p>Fatal and not retryable; the caller must change the configuration or the data.</p>
 *
 * @since 0.1.0
 */
public final class SplitConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message what could not be satisfied
   */
  public SplitConfigurationException(String message) {
    super(message);
  }
}
