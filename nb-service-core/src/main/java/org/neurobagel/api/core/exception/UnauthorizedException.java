package org.neurobagel.api.core.exception;

/**
 * Exception thrown when the graph store rejects the configured credentials.
 */
public class UnauthorizedException extends ServiceException {

  public UnauthorizedException(String message) {
    super(message);
  }

  public UnauthorizedException(String message, Throwable cause) {
    super(message, cause);
  }
}
