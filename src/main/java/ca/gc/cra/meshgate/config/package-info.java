/**
 * <strong>Purpose:</strong> Configuration records, YAML loading, and the composition root for the gateway.
 * <p><strong>Concurrency:</strong> Records are immutable; loaders are stateless.</p>
 * <p><strong>Observability:</strong> Invalid values surface as {@link java.lang.IllegalArgumentException};
 * CLI-over-YAML overrides are reported through a caller-supplied warning sink.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.config;
