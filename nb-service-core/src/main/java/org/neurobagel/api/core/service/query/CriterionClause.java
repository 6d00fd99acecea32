package org.neurobagel.api.core.service.query;

import java.util.function.BiConsumer;
import java.util.function.Predicate;

import org.apache.jena.query.ParameterizedSparqlString;

import org.neurobagel.api.core.pojo.Criterion;
import org.neurobagel.api.core.pojo.SearchCriteria;

/**
 * Contributes the constraint for one criterion to a subject query. A clause appends its own FILTER
 * and binds its own parameters, independently of every other clause.
 *
 * @param criterion the criterion this clause constrains
 * @param present   whether the criterion is set in a given criteria value
 * @param writer    appends the FILTER text and binds its parameter values
 */
record CriterionClause(Criterion criterion, Predicate<SearchCriteria> present,
    BiConsumer<ParameterizedSparqlString, SearchCriteria> writer) {

  boolean appliesTo(SearchCriteria criteria) {
    return present.test(criteria);
  }

  void appendTo(ParameterizedSparqlString query, SearchCriteria criteria) {
    writer.accept(query, criteria);
  }
}
