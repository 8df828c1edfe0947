package ca.gc.cra.meshgate.application.query;

import java.util.Objects;

/**
 * Checked exception raised by {@link QueryFacade} operations.
 *
 * @since 0.1.0
 */
public final class QueryException extends Exception {
  private final QueryError error;

  /**
   * Creates an exception.
   *
   * @param error failure category
   * @param msg human-readable detail suitable for API clients
   */
  public QueryException(QueryError error, String msg) {
    super(msg);
    this.error = Objects.requireNonNull(error, "error");
  }

  /**
   * Creates an exception wrapping a lower-level cause.
   *
   * @param error failure category
   * @param msg human-readable detail suitable for API clients
   * @param cause underlying failure
   */
  public QueryException(QueryError error, String msg, Throwable cause) {
    super(msg, cause);
    this.error = Objects.requireNonNull(error, "error");
  }

  /**
   * Returns the failure category.
   *
   * @return error category
   */
  public QueryError error() {
    return error;
  }
}
