package ca.gc.cra.tracesplit.application.port;

import ca.gc.cra.tracesplit.domain.split.SplitRecord;

/**
 * <strong>What:</strong> Port for writing split records.
 * <p><strong>Why:</strong> Allows the split pipeline to emit records without binding to a serialization format or
 * destination.</p>
 * <p><strong>Role:</strong> Output port on the sink side of the pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write records in repetition order.</li>
 *   <li>Flush buffered output and release the destination on close.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single writer.</p>
 *
 * @since 0.1.0
 */
public interface SplitRecordSink extends AutoCloseable {
  /**
   * Writes one record.
   *
   * @param record assembled split record; never {@code null}
   * @throws Exception if the destination rejects the write
   */
  void write(SplitRecord record) throws Exception;

  /**
   * Flushes buffered output.
   *
   * @throws Exception if flushing fails
   */
  default void flush() throws Exception {}

  /**
   * Closes the destination.
   *
   * @throws Exception if pending output cannot be written
   */
  @Override
  default void close() throws Exception {}
}
