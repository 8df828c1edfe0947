package ca.gc.cra.meshgate.api.http;

import ca.gc.cra.meshgate.application.query.QueryError;
import ca.gc.cra.meshgate.application.query.QueryException;
import ca.gc.cra.meshgate.application.query.QueryFacade;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serves the gateway query operations over HTTP.
 * <p><strong>Why:</strong> External tools read telemetry and send messages without speaking the radio
 * protocol.</p>
 * <p><strong>Role:</strong> Inbound adapter over {@link QueryFacade}; it owns no state of its own.</p>
 * <p><strong>Thread-safety:</strong> Requests run on the supplied executor; the facade is safe for
 * concurrent callers.</p>
 * <p><strong>Observability:</strong> Logs start/stop at INFO and unexpected handler failures at ERROR.</p>
 *
 * @since 0.1.0
 */
public final class MeshHttpServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MeshHttpServer.class);
  /** Path prefix for every API endpoint. */
  public static final String BASE_PATH = "/api/mesh";
  private static final int STOP_DELAY_SECONDS = 1;

  private final QueryFacade facade;
  private final InetSocketAddress bindAddress;
  private final ExecutorService executor;
  private final MeshJson json;
  private final byte[] indexPage;
  private final Map<String, Route> routes = new LinkedHashMap<>();
  private HttpServer server;

  /**
   * Creates a server; call {@link #start()} to bind.
   *
   * @param facade query operations to expose
   * @param host bind address
   * @param port bind port; {@code 0} selects an ephemeral port
   * @param executor request worker pool, shut down by {@link #close()}
   */
  public MeshHttpServer(QueryFacade facade, String host, int port, ExecutorService executor) {
    this.facade = Objects.requireNonNull(facade, "facade");
    this.bindAddress = new InetSocketAddress(Objects.requireNonNull(host, "host"), port);
    this.executor = Objects.requireNonNull(executor, "executor");
    this.json = new MeshJson(new ObjectMapper());
    this.indexPage = loadIndexPage();
    routes.put("/send_message", this::sendMessage);
    routes.put("/get_device_telemetry", exchange ->
        respond(exchange, 200, json.deviceTelemetry(facade.deviceTelemetry())));
    routes.put("/get_environment_telemetry", exchange ->
        respond(exchange, 200, json.environmentTelemetry(facade.environmentTelemetry())));
    routes.put("/get_last_messages", exchange -> respond(exchange, 200, json.messages(facade.lastMessages())));
    routes.put("/delete_message", this::deleteMessage);
    routes.put("/nodes", exchange -> respond(exchange, 200, json.nodes(facade.nodes())));
    routes.put("/status", exchange -> respond(exchange, 200, json.status(facade.status())));
  }

  /**
   * Binds the listener and starts serving.
   *
   * @throws IOException if the address cannot be bound
   * @throws IllegalStateException if already started
   */
  public synchronized void start() throws IOException {
    if (server != null) {
      throw new IllegalStateException("HTTP server already started");
    }
    HttpServer created = HttpServer.create(bindAddress, 0);
    created.createContext("/", this::handle);
    created.setExecutor(executor);
    created.start();
    server = created;
    log.info("HTTP server listening on {}:{}", bindAddress.getHostString(), port());
  }

  /**
   * Returns the bound port.
   *
   * @return listener port
   * @throws IllegalStateException if not started
   */
  public synchronized int port() {
    if (server == null) {
      throw new IllegalStateException("HTTP server not started");
    }
    return server.getAddress().getPort();
  }

  @Override
  public synchronized void close() {
    if (server != null) {
      server.stop(STOP_DELAY_SECONDS);
      server = null;
      log.info("HTTP server stopped");
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(STOP_DELAY_SECONDS, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void handle(HttpExchange exchange) throws IOException {
    try {
      String path = normalize(exchange.getRequestURI().getPath());
      if (path.isEmpty() || path.equals(BASE_PATH)) {
        writeHtml(exchange, indexPage);
        return;
      }
      Route route = path.startsWith(BASE_PATH + "/") ? routes.get(path.substring(BASE_PATH.length())) : null;
      if (route == null) {
        respond(exchange, 404, json.error("Not found: " + path));
        return;
      }
      route.handle(exchange);
    } catch (RuntimeException ex) {
      log.error("Unhandled failure serving {}", exchange.getRequestURI(), ex);
      if (exchange.getResponseCode() < 0) {
        respond(exchange, 500, json.error("Internal server error"));
      }
    } finally {
      exchange.close();
    }
  }

  private void sendMessage(HttpExchange exchange) throws IOException {
    Map<String, String> params = parameters(exchange);
    try {
      facade.sendMessage(params.get("message"), params.get("node_id"));
      respond(exchange, 200, json.outcome("success", "Message sent successfully"));
    } catch (QueryException ex) {
      respondFailure(exchange, ex);
    }
  }

  private void deleteMessage(HttpExchange exchange) throws IOException {
    Map<String, String> params = parameters(exchange);
    try {
      facade.deleteMessage(params.get("message_id"));
      respond(exchange, 200, json.outcome("success", "Message deleted successfully"));
    } catch (QueryException ex) {
      respondFailure(exchange, ex);
    }
  }

  private void respondFailure(HttpExchange exchange, QueryException ex) throws IOException {
    QueryError error = ex.error();
    if (!error.clientError()) {
      respond(exchange, 200, json.outcome("error", ex.getMessage()));
    } else if (error == QueryError.MISSING_PARAMETER) {
      respond(exchange, 404, json.error(ex.getMessage()));
    } else {
      respond(exchange, 400, json.error(ex.getMessage()));
    }
  }

  private void respond(HttpExchange exchange, int status, Object body) throws IOException {
    byte[] bytes = json.toBytes(body);
    exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private static void writeHtml(HttpExchange exchange, byte[] body) throws IOException {
    exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
    exchange.sendResponseHeaders(200, body.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(body);
    }
  }

  static Map<String, String> parameters(HttpExchange exchange) throws IOException {
    Map<String, String> params = new LinkedHashMap<>(parseQueryString(exchange.getRequestURI().getRawQuery()));
    if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
      return params;
    }
    String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
    String normalized = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
    byte[] raw = exchange.getRequestBody().readAllBytes();
    if (raw.length > 0 && (normalized.isEmpty() || normalized.contains("application/x-www-form-urlencoded"))) {
      params.putAll(parseQueryString(new String(raw, StandardCharsets.UTF_8).trim()));
    }
    return params;
  }

  static Map<String, String> parseQueryString(String query) {
    Map<String, String> out = new LinkedHashMap<>();
    if (query == null || query.isBlank()) {
      return out;
    }
    for (String pair : query.split("&")) {
      if (pair.isBlank()) {
        continue;
      }
      int idx = pair.indexOf('=');
      if (idx < 0) {
        out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
      } else {
        out.put(
            URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
            URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8));
      }
    }
    return out;
  }

  private static String normalize(String path) {
    String value = path == null ? "" : path;
    while (value.endsWith("/")) {
      value = value.substring(0, value.length() - 1);
    }
    return value;
  }

  private static byte[] loadIndexPage() {
    try (InputStream in = MeshHttpServer.class.getResourceAsStream("index.html")) {
      if (in == null) {
        throw new IllegalStateException("index.html missing from classpath");
      }
      return in.readAllBytes();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read index.html", ex);
    }
  }

  @FunctionalInterface
  private interface Route {
    void handle(HttpExchange exchange) throws IOException;
  }
}
