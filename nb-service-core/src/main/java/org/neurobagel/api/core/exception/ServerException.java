package org.neurobagel.api.core.exception;

/**
 * Signals a fault on the service side, independent of the caller's input.
 */
public class ServerException extends ServiceException {

  public ServerException(String message) {
    super(message);
  }

  public ServerException(String message, Throwable cause) {
    super(message, cause);
  }
}
