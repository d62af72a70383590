package ca.gc.cra.tracesplit.application.pipeline;

import ca.gc.cra.tracesplit.application.port.SplitRecordSink;
import java.io.IOException;

/**
 * Opens the record sink once every split record has been computed and verified.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SplitRecordSinkFactory {
  /**
   * Opens a sink for writing.
   *
   * @return open sink owned by the caller
   * @throws IOException if the destination cannot be opened
   */
  SplitRecordSink open() throws IOException;
}
