/**
 * <strong>Purpose:</strong> Connection lifecycle and packet ingestion for the mesh gateway bridge.
 * <p><strong>Pipeline role:</strong> {@link ca.gc.cra.meshgate.application.pipeline.ConnectionManager} owns the
 * radio link on a dedicated thread and forwards packets to
 * {@link ca.gc.cra.meshgate.application.pipeline.EventDispatcher}, which routes them into the stores.</p>
 * <p><strong>Concurrency:</strong> Single producer (the connection thread) for all store mutations except
 * message deletion, which request threads perform.</p>
 * <p><strong>Observability:</strong> Emits {@code mesh.connect.*}, {@code mesh.link.*} and
 * {@code mesh.packet.*} metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.application.pipeline;
