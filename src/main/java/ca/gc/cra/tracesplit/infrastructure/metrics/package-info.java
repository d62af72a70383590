/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link ca.gc.cra.tracesplit.application.port.MetricsPort}.
 * <p><strong>Observability:</strong> The OpenTelemetry adapter exports {@code split.*} counters and histograms over
 * OTLP when enabled.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracesplit.infrastructure.metrics;
