/**
 * <strong>Purpose:</strong> Trace label model: rows, protocol tags, and the columnar label table.
 * <p><strong>Pipeline role:</strong> Loaded once by label store readers; read-only for the rest of a run.
 * <p><strong>Concurrency:</strong> All types are immutable.
 * <p><strong>Performance:</strong> Columns are flat primitive arrays with interned protocol and region values.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracesplit.domain.trace;
