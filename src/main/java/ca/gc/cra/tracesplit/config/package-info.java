/**
 * <strong>Purpose:</strong> Configuration loading, merging, and typed validation, plus the composition root.
 * <p><strong>Precedence:</strong> command-line arguments over YAML ({@code common} + command section) over embedded
 * defaults.
 * <p><strong>Errors:</strong> Invalid values surface as {@link IllegalArgumentException} naming the key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracesplit.config;
