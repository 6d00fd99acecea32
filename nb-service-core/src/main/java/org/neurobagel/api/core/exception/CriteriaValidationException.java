package org.neurobagel.api.core.exception;

/**
 * Base class for rejected search criteria. Carries the name of the offending request parameter,
 * or of the rule for cross-field violations.
 */
public class CriteriaValidationException extends ClientException {

  private final String field;

  /**
   * Constructs a new CriteriaValidationException.
   *
   * @param field   the request parameter (or rule) that failed
   * @param message Detailed message about the thrown exception.
   */
  public CriteriaValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
