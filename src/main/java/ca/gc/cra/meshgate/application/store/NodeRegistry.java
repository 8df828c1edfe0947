package ca.gc.cra.meshgate.application.store;

import ca.gc.cra.meshgate.application.port.ClockPort;
import ca.gc.cra.meshgate.domain.mesh.MeshNode;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only record of every node observed on the mesh. The first reported long id wins; entries are
 * never replaced or removed.
 *
 * @since 0.1.0
 */
public final class NodeRegistry {
  private final ConcurrentMap<Long, MeshNode> nodes = new ConcurrentHashMap<>();
  private final ClockPort clock;

  /**
   * Creates a registry stamping first sightings with the system clock.
   */
  public NodeRegistry() {
    this(ClockPort.SYSTEM);
  }

  /**
   * Creates a registry.
   *
   * @param clock clock used for first-seen times
   */
  public NodeRegistry(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records a node unless it is already known.
   *
   * @param nodeNum numeric node id
   * @param longId long-form id; must not be {@code null}
   * @return {@code true} when the node was newly registered
   */
  public boolean registerIfAbsent(long nodeNum, String longId) {
    Objects.requireNonNull(longId, "longId");
    if (nodes.containsKey(nodeNum)) {
      return false;
    }
    return nodes.putIfAbsent(nodeNum, new MeshNode(nodeNum, longId, clock.nowMillis())) == null;
  }

  /**
   * Copies the registry.
   *
   * @return unmodifiable map ordered by node number
   */
  public Map<Long, MeshNode> snapshot() {
    return Collections.unmodifiableMap(new TreeMap<>(nodes));
  }
}
