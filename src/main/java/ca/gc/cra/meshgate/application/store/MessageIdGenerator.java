package ca.gc.cra.meshgate.application.store;

/**
 * Produces candidate identifiers for cached messages. The store rejects candidates already in use and asks
 * again, so implementations need only be collision resistant, not collision free.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface MessageIdGenerator {
  /**
   * Generates a candidate id for a message.
   *
   * @param nodeNum sender node
   * @param text message body
   * @return candidate identifier; never {@code null}
   */
  String generate(long nodeNum, String text);
}
