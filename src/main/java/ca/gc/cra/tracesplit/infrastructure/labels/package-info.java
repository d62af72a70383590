/**
 * <strong>Purpose:</strong> Input adapters loading label tables from HDF5 (jHDF) and NDJSON (Jackson) stores.
 * <p><strong>Errors:</strong> Every read failure surfaces as
 * {@link ca.gc.cra.tracesplit.application.port.LabelStoreException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracesplit.infrastructure.labels;
