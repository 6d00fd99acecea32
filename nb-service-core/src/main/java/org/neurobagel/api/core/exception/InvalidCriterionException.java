package org.neurobagel.api.core.exception;

/**
 * Exception thrown when a single criterion cannot be parsed or is out of its allowed range.
 */
public class InvalidCriterionException extends CriteriaValidationException {

  public InvalidCriterionException(String field, String message) {
    super(field, message);
  }
}
