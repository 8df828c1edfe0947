package ca.gc.cra.meshgate.application.query;

import ca.gc.cra.meshgate.domain.mesh.ConnectionPhase;
import ca.gc.cra.meshgate.domain.mesh.ConnectionState;

/**
 * Connection status as reported to API clients.
 *
 * @param connected whether a link is established
 * @param phase lifecycle phase
 * @param localNodeNum gateway node number, or {@code null} before the first connection
 * @param lastConnectedAtMillis epoch milliseconds of the latest connection, or {@code null}
 * @param connectionAttempts successful connections since start
 * @param failedAttempts failed connect calls since start
 * @since 0.1.0
 */
public record MeshStatus(
    boolean connected,
    ConnectionPhase phase,
    Long localNodeNum,
    Long lastConnectedAtMillis,
    long connectionAttempts,
    long failedAttempts) {

  static MeshStatus of(ConnectionState state) {
    return new MeshStatus(
        state.connected(),
        state.phase(),
        state.localNodeNum(),
        state.lastConnectedAtMillis(),
        state.connectionAttempts(),
        state.failedAttempts());
  }
}
