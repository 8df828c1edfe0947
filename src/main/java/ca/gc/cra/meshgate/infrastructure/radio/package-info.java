/**
 * <strong>Purpose:</strong> TCP adapter for a mesh gateway bridge speaking newline-delimited JSON.
 * <p><strong>Pipeline role:</strong> Implements {@link ca.gc.cra.meshgate.application.port.RadioTransport}
 * and {@link ca.gc.cra.meshgate.application.port.RadioLink}; gateway packets are decoded once here into
 * {@link ca.gc.cra.meshgate.domain.mesh.PacketEvent} and nothing above this package sees raw JSON.</p>
 * <p><strong>Concurrency:</strong> Each link owns one reader thread feeding a bounded queue; writes are
 * serialized per link.</p>
 * <p><strong>Metrics:</strong> {@code mesh.link.decode.dropped} and {@code mesh.link.queue.dropped}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.infrastructure.radio;
