/**
 * HTTP surface for the gateway, served by the JDK {@code com.sun.net.httpserver} server under
 * {@code /api/mesh}. Handlers are thin: they parse parameters, call
 * {@link ca.gc.cra.meshgate.application.query.QueryFacade}, and render JSON with Jackson.
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshgate.api.http;
