/**
 * <strong>Purpose:</strong> Input validation shared by the CLI, configuration, and HTTP layers.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 * <p><strong>Observability:</strong> Violations raise {@link java.lang.IllegalArgumentException}; nothing is logged here.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.validation;
