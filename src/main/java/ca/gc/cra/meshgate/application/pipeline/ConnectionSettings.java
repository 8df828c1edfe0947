package ca.gc.cra.meshgate.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing parameters for {@link ConnectionManager}.
 *
 * @param reconnectBackoff fixed wait between failed connect attempts
 * @param pollTimeout longest single wait for a packet before re-checking for shutdown
 * @param shutdownTimeout longest wait for the connection thread to exit on shutdown
 * @since 0.1.0
 */
public record ConnectionSettings(Duration reconnectBackoff, Duration pollTimeout, Duration shutdownTimeout) {
  private static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);
  private static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);
  private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  public ConnectionSettings {
    requirePositive("reconnectBackoff", reconnectBackoff);
    requirePositive("pollTimeout", pollTimeout);
    requirePositive("shutdownTimeout", shutdownTimeout);
  }

  /**
   * Returns the production defaults: 1 s backoff, 500 ms poll, 10 s shutdown wait.
   *
   * @return default settings
   */
  public static ConnectionSettings defaults() {
    return new ConnectionSettings(DEFAULT_BACKOFF, DEFAULT_POLL_TIMEOUT, DEFAULT_SHUTDOWN_TIMEOUT);
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
