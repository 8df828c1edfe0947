/**
 * <strong>Purpose:</strong> Ports separating the ingestion core from the radio gateway, metrics backend, and clock.
 * <p><strong>Pipeline role:</strong> Application layer; adapters under {@code infrastructure} implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Each port documents which threads may call it.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.application.port;
