package ca.gc.cra.meshgate.domain.mesh;

/**
 * Lifecycle phase of the single gateway connection.
 *
 * @since 0.1.0
 */
public enum ConnectionPhase {
  /** No link is held; the manager is idle, backing off, or shutting down. */
  DISCONNECTED,
  /** A connect attempt is in flight. */
  CONNECTING,
  /** A link is established and packets are being forwarded. */
  CONNECTED
}
