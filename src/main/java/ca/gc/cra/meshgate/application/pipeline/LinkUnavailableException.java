package ca.gc.cra.meshgate.application.pipeline;

/**
 * Checked exception raised when an operation needs the radio link while none is established.
 *
 * @since 0.1.0
 */
public final class LinkUnavailableException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable reason
   */
  public LinkUnavailableException(String msg) { super(msg); }
}
