/**
 * <strong>Purpose:</strong> Ports defining the load -> split -> write workflow contracts.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Observability:</strong> {@link ca.gc.cra.tracesplit.application.port.MetricsPort} decouples pipelines
 * from the metrics SDK.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracesplit.application.port;
