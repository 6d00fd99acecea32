package org.neurobagel.api.core.exception;

/**
 * Exception thrown when a term value does not have the {@code prefix:accession} shape.
 */
public class MalformedTermException extends CriteriaValidationException {

  private final String value;

  public MalformedTermException(String field, String value) {
    super(field, field + " '" + value + "' is not a compact identifier of the form prefix:accession");
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
