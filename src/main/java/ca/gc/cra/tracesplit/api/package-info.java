/**
 * Command-line entry points: the {@code tracesplit} dispatcher and its {@code split} and {@code describe} commands.
 * <p><strong>Role:</strong> Driving adapters; parse arguments, layer configuration, configure logging and
 * telemetry, then invoke use cases through the composition root.</p>
 * <p><strong>Output:</strong> Records and summaries go to stdout; diagnostics go to stderr through Logback.</p>
 */
package ca.gc.cra.tracesplit.api;
