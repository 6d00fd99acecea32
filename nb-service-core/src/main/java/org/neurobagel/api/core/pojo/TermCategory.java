package org.neurobagel.api.core.pojo;

/**
 * Criteria whose values are controlled-vocabulary terms given as compact identifiers.
 */
public enum TermCategory {
  DIAGNOSIS("diagnosis"),
  ASSESSMENT("assessment"),
  IMAGE_MODAL("image_modal");

  private final String parameterName;

  TermCategory(String parameterName) {
    this.parameterName = parameterName;
  }

  public String getParameterName() {
    return parameterName;
  }
}
