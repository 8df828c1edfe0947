package ca.gc.cra.meshgate.application.store;

import ca.gc.cra.meshgate.application.port.ClockPort;
import ca.gc.cra.meshgate.application.port.MetricsPort;
import ca.gc.cra.meshgate.domain.mesh.Message;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bounded, arrival-ordered cache of inbound text messages.
 * <p><strong>Role:</strong> Inserted into by the event dispatcher; read and pruned by request threads.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Assign each message an id not present in the cache at insertion time.</li>
 *   <li>Keep at most {@code capacity} messages, evicting the oldest arrival first.</li>
 *   <li>Delete by id on request.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All access is guarded by the store's monitor; critical sections cover a
 * single insert, delete, or copy.</p>
 * <p><strong>Observability:</strong> Counts evictions under {@code mesh.message.evicted}.</p>
 *
 * @since 0.1.0
 */
public final class MessageStore {
  private static final Logger log = LoggerFactory.getLogger(MessageStore.class);

  /** Capacity used when none is configured. */
  public static final int DEFAULT_CAPACITY = 100;

  private final int capacity;
  private final MessageIdGenerator idGenerator;
  private final ClockPort clock;
  private final MetricsPort metrics;
  // Insertion-ordered, so the first entry is always the oldest arrival.
  private final LinkedHashMap<String, Message> messages = new LinkedHashMap<>();
  private long nextArrival;

  /**
   * Creates a store with the default capacity and MD5-based ids.
   */
  public MessageStore() {
    this(DEFAULT_CAPACITY, new Md5MessageIdGenerator(), ClockPort.SYSTEM, MetricsPort.NO_OP);
  }

  /**
   * Creates a store.
   *
   * @param capacity maximum retained messages; must be positive
   * @param idGenerator source of candidate ids
   * @param clock clock stamping receive times
   * @param metrics metrics sink for evictions
   */
  public MessageStore(int capacity, MessageIdGenerator idGenerator, ClockPort clock, MetricsPort metrics) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Caches a message, evicting the oldest one when the store is full.
   *
   * @param nodeNum sender node
   * @param text message body; must not be {@code null}
   * @return the stored message including its generated id
   */
  public Message insert(long nodeNum, String text) {
    Objects.requireNonNull(text, "text");
    long now = clock.nowMillis();
    Message evicted = null;
    Message stored;
    synchronized (this) {
      String id = idGenerator.generate(nodeNum, text);
      while (messages.containsKey(id)) {
        log.debug("Regenerating message id after collision on {}", id);
        id = idGenerator.generate(nodeNum, text);
      }
      stored = new Message(id, nodeNum, text, nextArrival++, now);
      messages.put(id, stored);
      if (messages.size() > capacity) {
        Iterator<Message> oldest = messages.values().iterator();
        evicted = oldest.next();
        oldest.remove();
      }
    }
    if (evicted != null) {
      metrics.increment("mesh.message.evicted");
      log.debug("Evicted message {} from node {} at capacity {}", evicted.id(), evicted.nodeNum(), capacity);
    }
    return stored;
  }

  /**
   * Removes the message with the given id.
   *
   * @param id message id
   * @return the removed message, or empty when no message has that id
   */
  public synchronized Optional<Message> delete(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(messages.remove(id));
  }

  /**
   * Copies the cache in arrival order.
   *
   * @return unmodifiable map from id to message, oldest first
   */
  public synchronized Map<String, Message> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(messages));
  }

  /**
   * Returns the number of cached messages.
   *
   * @return current size, never above {@link #capacity()}
   */
  public synchronized int size() {
    return messages.size();
  }

  /**
   * Returns the configured capacity.
   *
   * @return maximum retained messages
   */
  public int capacity() {
    return capacity;
  }
}
