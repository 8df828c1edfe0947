package ca.gc.cra.meshgate.domain.mesh;

import java.util.Objects;

/**
 * Node observed on the mesh. The first sighting is kept; later packets never replace it.
 *
 * @param nodeNum numeric node id
 * @param longId long-form id as first reported
 * @param firstSeenMillis epoch milliseconds of the first sighting
 * @since 0.1.0
 */
public record MeshNode(long nodeNum, String longId, long firstSeenMillis) {
  public MeshNode {
    Objects.requireNonNull(longId, "longId");
  }
}
