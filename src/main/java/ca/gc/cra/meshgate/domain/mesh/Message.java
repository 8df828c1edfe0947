package ca.gc.cra.meshgate.domain.mesh;

import java.util.Objects;

/**
 * <strong>What:</strong> Inbound text message cached for query clients.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param id locally generated identifier, unique within the cache when inserted
 * @param nodeNum sender node number
 * @param text message body; never {@code null}
 * @param arrivalOrder monotonically increasing sequence assigned on insertion
 * @param receivedAtMillis epoch milliseconds when the message was cached
 * @since 0.1.0
 */
public record Message(String id, long nodeNum, String text, long arrivalOrder, long receivedAtMillis) {
  public Message {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(text, "text");
  }
}
