package org.neurobagel.api.core.exception;

/**
 * Exception thrown when individually valid criteria contradict each other.
 */
public class ConflictingCriteriaException extends CriteriaValidationException {

  public ConflictingCriteriaException(String rule, String message) {
    super(rule, message);
  }
}
