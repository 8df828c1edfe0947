/**
 * Executor factories for the HTTP request workers.
 * <p><strong>Concurrency:</strong> Pools are fixed-size with a bounded queue; overflow is rejected rather than
 * buffered.</p>
 * <p><strong>Performance:</strong> Worker threads are named {@code mesh-http-N} so thread dumps stay readable.</p>
 */
package ca.gc.cra.meshgate.infrastructure.exec;
