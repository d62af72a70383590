package ca.gc.cra.tracesplit.domain.trace;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Transport protocol tag attached to every trace in the label store.
 * <p><strong>Why:</strong> Splits keep training data TCP-only and meter QUIC into test sets, so the
 * engine needs a single place that decides whether a tag means TCP.</p>
 * <p><strong>Role:</strong> Domain value used by the label table, stratum encoder, and protocol mixer.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 * <p><strong>Performance:</strong> Tags are normalized once at construction; comparisons are string compares.</p>
 *
 * @param tag lower-case protocol tag such as {@code tcp}, {@code quic} or a QUIC version tag like {@code h3-29}
 * @since 0.1.0
 */
public record TransportProtocol(String tag) implements Comparable<TransportProtocol> {
  /** Canonical tag used for TCP traces. */
  public static final String TCP_TAG = "tcp";
  /** Shared TCP instance. */
  public static final TransportProtocol TCP = new TransportProtocol(TCP_TAG);

  /**
   * Normalizes the tag to trimmed lower case.
   *
   * @throws NullPointerException if {@code tag} is {@code null}
   * @throws IllegalArgumentException if the tag is blank
   */
  public TransportProtocol {
    Objects.requireNonNull(tag, "tag");
    String normalized = tag.trim().toLowerCase(Locale.ROOT);
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("protocol tag must not be blank");
    }
    tag = normalized;
  }

  /**
   * Parses a raw tag, reusing {@link #TCP} for TCP values.
   *
   * @param raw raw tag from the label store
   * @return protocol value
   */
  public static TransportProtocol of(String raw) {
    TransportProtocol protocol = new TransportProtocol(raw);
    return protocol.isTcp() ? TCP : protocol;
  }

  /**
   * Indicates whether this tag denotes TCP.
   *
   * @return {@code true} for {@code tcp}
   */
  public boolean isTcp() {
    return TCP_TAG.equals(tag);
  }

  @Override
  public int compareTo(TransportProtocol other) {
    return tag.compareTo(other.tag);
  }

  @Override
  public String toString() {
    return tag;
  }
}
