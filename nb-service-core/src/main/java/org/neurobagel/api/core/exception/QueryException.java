package org.neurobagel.api.core.exception;

/**
 * Exception thrown when the graph store is reachable but a query cannot be built or executed.
 */
public class QueryException extends ServerException {

  /**
   * Constructs a new QueryException with the specified detail message.
   *
   * @param message Detailed message about the thrown exception.
   */
  public QueryException(String message) {
    super(message);
  }

  /**
   * Constructs a new QueryException with the specified detail message and cause.
   *
   * @param message Detailed message about the thrown exception.
   * @param cause   Underlying store or transport failure.
   */
  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
