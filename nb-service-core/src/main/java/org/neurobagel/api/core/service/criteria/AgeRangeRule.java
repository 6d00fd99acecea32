package org.neurobagel.api.core.service.criteria;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import org.neurobagel.api.core.exception.ConflictingCriteriaException;
import org.neurobagel.api.core.pojo.SearchCriteria;

/**
 * A lower age bound may not exceed the upper one. Equal bounds select exactly that age.
 */
@Component
@Order(1)
public class AgeRangeRule implements CrossFieldRule {

  @Override
  public void check(SearchCriteria criteria) {
    Double min = criteria.getMinAge();
    Double max = criteria.getMaxAge();
    if (min != null && max != null && min > max) {
      throw new ConflictingCriteriaException("age_range",
          "min_age (" + min + ") must be less than or equal to max_age (" + max + ").");
    }
  }
}
