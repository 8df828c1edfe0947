package ca.gc.cra.meshgate.application.query;

/**
 * <strong>What:</strong> Failure categories reported by {@link QueryFacade}.
 * <p><strong>Role:</strong> Lets the HTTP layer choose a status code without inspecting messages.</p>
 *
 * @since 0.1.0
 */
public enum QueryError {
  /** A required parameter was absent. */
  MISSING_PARAMETER(true),
  /** The send target does not name a mesh node. */
  INVALID_NODE_ID(true),
  /** The referenced message is not cached. */
  NOT_FOUND(true),
  /** No gateway link is established. */
  NOT_CONNECTED(false),
  /** The gateway link failed while sending. */
  SEND_FAILED(false);

  private final boolean clientError;

  QueryError(boolean clientError) {
    this.clientError = clientError;
  }

  /**
   * Indicates whether the caller caused the failure.
   *
   * @return {@code true} for caller mistakes, {@code false} for transient link conditions
   */
  public boolean clientError() {
    return clientError;
  }
}
