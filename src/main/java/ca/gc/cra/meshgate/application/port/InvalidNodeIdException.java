package ca.gc.cra.meshgate.application.port;

/**
 * Checked exception raised when a send target does not identify a mesh node.
 *
 * @since 0.1.0
 */
public final class InvalidNodeIdException extends Exception {
  private final String target;

  /**
   * Creates an exception for the rejected target.
   *
   * @param target target reference supplied by the caller
   */
  public InvalidNodeIdException(String target) {
    super("Invalid node ID: " + target);
    this.target = target;
  }

  /**
   * Returns the rejected target reference.
   *
   * @return target as supplied
   */
  public String target() {
    return target;
  }
}
