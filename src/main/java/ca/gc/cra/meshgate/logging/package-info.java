/**
 * <strong>Purpose:</strong> Logging helpers that tune verbosity and keep message bodies short in logs.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.logging;
