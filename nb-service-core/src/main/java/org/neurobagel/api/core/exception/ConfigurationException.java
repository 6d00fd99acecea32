package org.neurobagel.api.core.exception;

/**
 * Exception thrown at startup when required configuration is missing. The service never starts degraded.
 */
public class ConfigurationException extends ServiceException {

  /**
   * Constructs a new ConfigurationException with the specified detail message.
   *
   * @param message Detailed message about the thrown exception.
   */
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
