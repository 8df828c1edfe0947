package ca.gc.cra.meshgate.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the gateway bridge.
 * <p><strong>Why:</strong> Lets the connection loop, dispatcher, and stores count events without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from the connection
 * thread and request threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name (for example {@code mesh.packet.received}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value (for example nanoseconds)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates; useful for tests. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
