package org.neurobagel.api.core.exception;

/**
 * Signals a fault in the caller's input. Never caused by the graph store.
 */
public class ClientException extends ServiceException {

  public ClientException(String message) {
    super(message);
  }
}
