/**
 * <strong>Purpose:</strong> Splitting engine: trace selection, the monitored and unmonitored splitters, protocol
 * mixing, assembly, and invariant checks.
 * <p><strong>Pipeline role:</strong> Application layer between the label store and the record sink.</p>
 * <p><strong>Concurrency:</strong> Single-threaded; randomness is passed in explicitly.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracesplit.application.split;
