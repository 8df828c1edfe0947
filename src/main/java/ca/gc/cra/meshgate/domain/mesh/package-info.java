/**
 * <strong>Purpose:</strong> Immutable value types describing mesh packets, nodes, telemetry, and link state.
 * <p><strong>Pipeline role:</strong> Domain layer shared by the radio adapter, ingestion pipeline, stores, and query facade.</p>
 * <p><strong>Concurrency:</strong> Records are immutable and safe to share across the connection and request threads.</p>
 * <p><strong>Observability:</strong> Field names mirror the JSON exposed on the HTTP surface.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.domain.mesh;
