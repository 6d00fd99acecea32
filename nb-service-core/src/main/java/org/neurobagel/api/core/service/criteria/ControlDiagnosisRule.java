package org.neurobagel.api.core.service.criteria;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import org.neurobagel.api.core.exception.ConflictingCriteriaException;
import org.neurobagel.api.core.pojo.SearchCriteria;

/**
 * Healthy controls carry no diagnosis, so asking for both can never match.
 */
@Component
@Order(2)
public class ControlDiagnosisRule implements CrossFieldRule {

  static final String MESSAGE = "Subjects cannot both be healthy controls and have a diagnosis.";

  @Override
  public void check(SearchCriteria criteria) {
    if (Boolean.TRUE.equals(criteria.getIsControl()) && criteria.getDiagnosis() != null) {
      throw new ConflictingCriteriaException("is_control", MESSAGE);
    }
  }
}
