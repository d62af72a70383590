/**
 * <strong>Purpose:</strong> Use cases wiring label stores, the splitting engine, and record sinks.
 * <p><strong>Pipeline role:</strong> Application layer invoked by the CLI entry points.</p>
 * <p><strong>Observability:</strong> Emits {@code split.*} metrics and MDC context.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracesplit.application.pipeline;
