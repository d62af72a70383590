/**
 * <strong>Purpose:</strong> Split value types and the primitives the splitters share: seeded randomness, index set
 * algebra, stratum encoding, fraction rounding, and the error taxonomy.
 * <p><strong>Concurrency:</strong> Values are immutable; {@link ca.gc.cra.tracesplit.domain.split.SplitRandom} is
 * confined to one thread.
 * <p><strong>Errors:</strong> {@link ca.gc.cra.tracesplit.domain.split.SplitConfigurationException} for data that
 * cannot satisfy the parameters, {@link ca.gc.cra.tracesplit.domain.split.SplitInvariantException} for broken
 * partitions.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracesplit.domain.split;
