package ca.gc.cra.meshgate.domain.mesh;

/**
 * <strong>What:</strong> Device health readings reported by a node's telemetry packet.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param batteryLevel battery charge percentage; {@code null} when not reported
 * @param voltage battery voltage; {@code null} when not reported
 * @param channelUtilization percentage of airtime observed busy; {@code null} when not reported
 * @param airUtilTx percentage of airtime used by this node's transmissions; {@code null} when not reported
 * @since 0.1.0
 */
public record DeviceMetrics(
    Integer batteryLevel, Double voltage, Double channelUtilization, Double airUtilTx) {}
