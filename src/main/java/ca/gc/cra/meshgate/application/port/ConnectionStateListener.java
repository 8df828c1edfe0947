package ca.gc.cra.meshgate.application.port;

import ca.gc.cra.meshgate.domain.mesh.ConnectionState;

/**
 * Observer notified after every connection phase change.
 * <p>Called on the connection thread; implementations must return quickly.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ConnectionStateListener {
  /**
   * Receives the newly published state.
   *
   * @param state snapshot after the change
   */
  void onStateChanged(ConnectionState state);

  /** Listener that ignores all changes. */
  ConnectionStateListener NO_OP = state -> {};
}
