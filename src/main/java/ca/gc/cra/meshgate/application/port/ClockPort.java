package ca.gc.cra.meshgate.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the stores and connection manager.
 * <p><strong>Why:</strong> Lets tests pin first-seen, receive, and connect times.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; reads occur on the connection
 * thread and request threads.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
