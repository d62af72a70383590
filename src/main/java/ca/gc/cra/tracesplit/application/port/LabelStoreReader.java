package ca.gc.cra.tracesplit.application.port;

import ca.gc.cra.tracesplit.domain.trace.LabelTable;

/**
 * <strong>What:</strong> Port loading the label table of a trace dataset.
 * <p><strong>Why:</strong> Keeps the split pipeline independent of the on-disk format.</p>
 * <p><strong>Role:</strong> Input port implemented by the HDF5 and NDJSON readers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read every row of the store into an immutable {@link LabelTable}.</li>
 *   <li>Report missing files, missing columns, and malformed rows as {@link LabelStoreException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Readers are used once from a single thread.</p>
 *
 * @since 0.1.0
 */
public interface LabelStoreReader {
  /**
   * Loads the complete label table.
   *
   * @return label table indexed {@code 0..N-1} in store order
   * @throws LabelStoreException if the store cannot be read or fails validation
   */
  LabelTable read() throws LabelStoreException;

  /**
   * Describes the store for logs and dry-run output.
   *
   * @return human-readable source description
   */
  String describe();
}
