/**
 * Thread-safe query surface used by the HTTP layer.
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.application.query;
