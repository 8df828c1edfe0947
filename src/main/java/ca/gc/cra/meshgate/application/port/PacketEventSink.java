package ca.gc.cra.meshgate.application.port;

import ca.gc.cra.meshgate.domain.mesh.PacketEvent;

/**
 * <strong>What:</strong> Typed channel receiving packets forwarded by the connection manager.
 * <p><strong>Role:</strong> Implemented by {@code EventDispatcher}; tests substitute recording sinks.</p>
 * <p><strong>Thread-safety:</strong> Invoked from the connection thread only, in arrival order.</p>
 * <p><strong>Performance:</strong> Implementations must not block on I/O.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PacketEventSink {
  /**
   * Handles one decoded packet.
   *
   * @param event packet received from the gateway; never {@code null}
   */
  void onPacket(PacketEvent event);
}
