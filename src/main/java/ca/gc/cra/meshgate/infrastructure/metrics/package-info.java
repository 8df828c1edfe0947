/**
 * OpenTelemetry implementation of {@link ca.gc.cra.meshgate.application.port.MetricsPort}.
 * <p>Exporter selection follows the {@code otel.*} system properties and {@code OTEL_*} environment
 * variables; {@code none} yields a noop adapter.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.infrastructure.metrics;
