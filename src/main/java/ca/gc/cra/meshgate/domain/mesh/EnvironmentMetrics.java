package ca.gc.cra.meshgate.domain.mesh;

/**
 * <strong>What:</strong> Environment sensor readings reported by a node's telemetry packet.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param temperature degrees Celsius; {@code null} when not reported
 * @param relativeHumidity relative humidity percentage; {@code null} when not reported
 * @param barometricPressure pressure in hPa; {@code null} when not reported
 * @since 0.1.0
 */
public record EnvironmentMetrics(
    Double temperature, Double relativeHumidity, Double barometricPressure) {}
