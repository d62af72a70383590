/**
 * <strong>Purpose:</strong> Output adapters writing split records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracesplit.infrastructure.persistence;
