package ca.gc.cra.meshgate.domain.mesh;

/**
 * <strong>What:</strong> One decoded packet received from the radio gateway.
 * <p><strong>Why:</strong> Radio adapters decode the gateway payload exactly once into this shape so the
 * dispatcher never inspects untyped maps.</p>
 * <p><strong>Role:</strong> Domain value handed from the connection thread to the event dispatcher.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>Every payload section is optional; a single packet may carry several (for example telemetry and a
 * sender long id). Absent sections are {@code null}.</p>
 *
 * @param from sender node number, or {@code null} when the gateway omitted it
 * @param fromId sender long-form identifier (for example {@code !a1b2c3d4}), or {@code null}
 * @param portNum application port name reported by the gateway, or {@code null}
 * @param telemetry telemetry section, or {@code null}
 * @param text text payload, or {@code null}
 * @since 0.1.0
 */
public record PacketEvent(Long from, String fromId, String portNum, Telemetry telemetry, String text) {

  /**
   * Indicates whether the packet carried a text payload.
   *
   * @return {@code true} when {@link #text()} is non-null
   */
  public boolean hasText() {
    return text != null;
  }

  /**
   * Indicates whether the packet carried a telemetry section.
   *
   * @return {@code true} when {@link #telemetry()} is non-null
   */
  public boolean hasTelemetry() {
    return telemetry != null;
  }
}
