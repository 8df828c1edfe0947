/**
 * <strong>Purpose:</strong> Command-line entry points for the gateway.
 * <p><strong>Pipeline role:</strong> Parses {@code key=value} arguments, merges YAML configuration, and starts
 * the composition root.</p>
 * <p><strong>Concurrency:</strong> Commands run on the invoking thread; the serve command blocks until the JVM
 * shuts down.</p>
 * <p><strong>Observability:</strong> Emits INFO lifecycle logs and maps failures to {@link ca.gc.cra.meshgate.api.ExitCode}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.api;
