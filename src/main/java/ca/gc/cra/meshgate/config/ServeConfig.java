package ca.gc.cra.meshgate.config;

import ca.gc.cra.meshgate.application.pipeline.ConnectionSettings;
import ca.gc.cra.meshgate.application.store.MessageStore;
import ca.gc.cra.meshgate.infrastructure.radio.TcpRadioTransport;
import ca.gc.cra.meshgate.validation.Net;
import ca.gc.cra.meshgate.validation.Numbers;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for the {@code serve} command.
 *
 * @param radioAddress gateway address normalized to {@code host:port}
 * @param httpHost address the HTTP listener binds to
 * @param httpPort HTTP listener port; {@code 0} picks an ephemeral port
 * @param httpWorkers number of HTTP request worker threads
 * @param messageCapacity number of recent messages retained
 * @param reconnectBackoffMillis pause between failed connect attempts
 * @param pollTimeoutMillis maximum wait per link poll
 * @param handshakeTimeoutMillis connect and handshake timeout for the gateway
 * @since 0.1.0
 */
public record ServeConfig(
    String radioAddress,
    String httpHost,
    int httpPort,
    int httpWorkers,
    int messageCapacity,
    int reconnectBackoffMillis,
    int pollTimeoutMillis,
    int handshakeTimeoutMillis) {

  static final String DEFAULT_HTTP_HOST = "127.0.0.1";
  static final int DEFAULT_HTTP_PORT = 8080;
  static final int DEFAULT_HTTP_WORKERS = 8;
  static final int DEFAULT_RECONNECT_BACKOFF_MILLIS = 1_000;
  static final int DEFAULT_POLL_TIMEOUT_MILLIS = 500;
  static final int DEFAULT_HANDSHAKE_TIMEOUT_MILLIS = 5_000;
  private static final int MAX_HTTP_WORKERS = 64;
  private static final int MAX_MESSAGE_CAPACITY = 10_000;

  /**
   * Validates and normalizes values.
   */
  public ServeConfig {
    radioAddress = Net.validateHostPort(radioAddress, TcpRadioTransport.DEFAULT_PORT);
    httpHost = Net.validateHost(httpHost);
    Numbers.requireRange("httpPort", httpPort, 0, 65_535);
    Numbers.requireRange("httpWorkers", httpWorkers, 1, MAX_HTTP_WORKERS);
    Numbers.requireRange("messageCapacity", messageCapacity, 1, MAX_MESSAGE_CAPACITY);
    Numbers.requireRange("reconnectBackoffMillis", reconnectBackoffMillis, 1, 600_000);
    Numbers.requireRange("pollTimeoutMillis", pollTimeoutMillis, 10, 60_000);
    Numbers.requireRange("handshakeTimeoutMillis", handshakeTimeoutMillis, 100, 120_000);
  }

  /**
   * Builds a configuration from flattened key/value pairs, applying defaults for absent keys.
   *
   * @param args CLI or merged YAML values
   * @return validated configuration
   * @throws IllegalArgumentException if {@code radio} is missing or any value is out of range
   */
  public static ServeConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : args;
    String radio = kv.get("radio");
    if (radio == null || radio.isBlank()) {
      throw new IllegalArgumentException("radio is required (host or host:port of the mesh gateway)");
    }
    String httpHost = kv.get("httpHost");
    return new ServeConfig(
        radio,
        httpHost == null || httpHost.isBlank() ? DEFAULT_HTTP_HOST : httpHost,
        intValue(kv, "httpPort", DEFAULT_HTTP_PORT, 0, 65_535),
        intValue(kv, "httpWorkers", DEFAULT_HTTP_WORKERS, 1, MAX_HTTP_WORKERS),
        intValue(kv, "messageCapacity", MessageStore.DEFAULT_CAPACITY, 1, MAX_MESSAGE_CAPACITY),
        intValue(kv, "reconnectBackoffMillis", DEFAULT_RECONNECT_BACKOFF_MILLIS, 1, 600_000),
        intValue(kv, "pollTimeoutMillis", DEFAULT_POLL_TIMEOUT_MILLIS, 10, 60_000),
        intValue(kv, "handshakeTimeoutMillis", DEFAULT_HANDSHAKE_TIMEOUT_MILLIS, 100, 120_000));
  }

  /**
   * Returns defaults for every optional key, as the flat map used by {@link ConfigMerger}.
   *
   * @return immutable map of defaults
   */
  public static Map<String, String> defaultsAsFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("httpHost", DEFAULT_HTTP_HOST);
    map.put("httpPort", Integer.toString(DEFAULT_HTTP_PORT));
    map.put("httpWorkers", Integer.toString(DEFAULT_HTTP_WORKERS));
    map.put("messageCapacity", Integer.toString(MessageStore.DEFAULT_CAPACITY));
    map.put("reconnectBackoffMillis", Integer.toString(DEFAULT_RECONNECT_BACKOFF_MILLIS));
    map.put("pollTimeoutMillis", Integer.toString(DEFAULT_POLL_TIMEOUT_MILLIS));
    map.put("handshakeTimeoutMillis", Integer.toString(DEFAULT_HANDSHAKE_TIMEOUT_MILLIS));
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  /**
   * Derives connection loop timings.
   *
   * @return settings for {@link ca.gc.cra.meshgate.application.pipeline.ConnectionManager}
   */
  public ConnectionSettings connectionSettings() {
    return new ConnectionSettings(
        Duration.ofMillis(reconnectBackoffMillis),
        Duration.ofMillis(pollTimeoutMillis),
        ConnectionSettings.defaults().shutdownTimeout());
  }

  /**
   * Returns the handshake timeout as a duration.
   *
   * @return handshake timeout
   */
  public Duration handshakeTimeout() {
    return Duration.ofMillis(handshakeTimeoutMillis);
  }

  private static int intValue(Map<String, String> kv, String key, int fallback, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }
}
