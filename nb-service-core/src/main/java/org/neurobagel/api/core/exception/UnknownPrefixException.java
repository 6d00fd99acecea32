package org.neurobagel.api.core.exception;

/**
 * Exception thrown when a well-formed term uses a vocabulary prefix that is not registered.
 */
public class UnknownPrefixException extends CriteriaValidationException {

  private final String value;
  private final String prefix;

  /**
   * Constructs a new UnknownPrefixException.
   *
   * @param field  the request parameter holding the term
   * @param value  the full term as received
   * @param prefix the unrecognised prefix
   */
  public UnknownPrefixException(String field, String value, String prefix) {
    super(field, field + " '" + value + "' uses the unrecognized vocabulary prefix '" + prefix + "'");
    this.value = value;
    this.prefix = prefix;
  }

  public String getValue() {
    return value;
  }

  public String getPrefix() {
    return prefix;
  }
}
