package org.neurobagel.api.core.exception;

/**
 * Base class of all unchecked exceptions raised by the query service.
 */
public class ServiceException extends RuntimeException {

  /**
   * Constructs a new ServiceException with the specified detail message.
   *
   * @param message Detailed message about the thrown exception.
   */
  public ServiceException(String message) {
    super(message);
  }

  /**
   * Constructs a new ServiceException with the specified detail message and cause.
   *
   * @param message Detailed message about the thrown exception.
   * @param cause   Underlying failure.
   */
  public ServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
