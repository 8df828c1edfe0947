package ca.gc.cra.meshgate.domain.mesh;

import java.util.Objects;

/**
 * <strong>What:</strong> Point-in-time snapshot of the gateway connection.
 * <p><strong>Role:</strong> Written only by the connection manager; read by any request thread.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the manager publishes a fresh instance on every change.</p>
 *
 * @param phase current lifecycle phase
 * @param localNodeNum the gateway's own node number, or {@code null} before the first connection
 * @param connectionAttempts number of successful connections since process start
 * @param failedAttempts number of failed connect calls since process start
 * @param lastConnectedAtMillis epoch milliseconds of the latest successful connection, or {@code null}
 * @since 0.1.0
 */
public record ConnectionState(
    ConnectionPhase phase,
    Long localNodeNum,
    long connectionAttempts,
    long failedAttempts,
    Long lastConnectedAtMillis) {

  public ConnectionState {
    Objects.requireNonNull(phase, "phase");
  }

  /**
   * Returns the state of a manager that has not attempted a connection yet.
   *
   * @return disconnected state with zeroed counters
   */
  public static ConnectionState initial() {
    return new ConnectionState(ConnectionPhase.DISCONNECTED, null, 0L, 0L, null);
  }

  /**
   * Indicates whether a link is currently established.
   *
   * @return {@code true} in the {@link ConnectionPhase#CONNECTED} phase
   */
  public boolean connected() {
    return phase == ConnectionPhase.CONNECTED;
  }

  /**
   * Returns a copy in the given phase with counters unchanged.
   *
   * @param next phase to move to
   * @return updated snapshot
   */
  public ConnectionState transition(ConnectionPhase next) {
    return new ConnectionState(
        Objects.requireNonNull(next, "next"), localNodeNum, connectionAttempts, failedAttempts, lastConnectedAtMillis);
  }

  /**
   * Returns the snapshot that follows a successful connection.
   *
   * @param localNode gateway node number reported by the link
   * @param nowMillis connection time in epoch milliseconds
   * @return connected snapshot with the success counter advanced
   */
  public ConnectionState connectedTo(long localNode, long nowMillis) {
    return new ConnectionState(
        ConnectionPhase.CONNECTED, localNode, connectionAttempts + 1, failedAttempts, nowMillis);
  }

  /**
   * Returns the snapshot that follows a failed connect call.
   *
   * @return disconnected snapshot with the failure counter advanced
   */
  public ConnectionState connectFailed() {
    return new ConnectionState(
        ConnectionPhase.DISCONNECTED, localNodeNum, connectionAttempts, failedAttempts + 1, lastConnectedAtMillis);
  }
}
