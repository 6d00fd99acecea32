package org.neurobagel.api.core.service.criteria;

import org.neurobagel.api.core.exception.CriteriaValidationException;
import org.neurobagel.api.core.pojo.SearchCriteria;

/**
 * An invariant spanning several criteria, checked once every field has been parsed.
 */
public interface CrossFieldRule {

  /**
   * @param criteria criteria whose fields are individually valid
   * @throws CriteriaValidationException if the invariant does not hold
   */
  void check(SearchCriteria criteria);
}
