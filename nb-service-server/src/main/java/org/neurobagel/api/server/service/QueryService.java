package org.neurobagel.api.server.service;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import org.neurobagel.api.core.pojo.DatasetMatch;
import org.neurobagel.api.core.pojo.SearchCriteria;
import org.neurobagel.api.core.pojo.SearchParameters;
import org.neurobagel.api.core.pojo.SubjectQuery;
import org.neurobagel.api.core.pojo.SubjectRow;
import org.neurobagel.api.core.service.criteria.CriteriaValidator;
import org.neurobagel.api.core.service.graphdb.GraphStore;
import org.neurobagel.api.core.service.query.SubjectQueryBuilder;
import org.neurobagel.api.core.service.result.ResultAggregator;
import lombok.extern.slf4j.Slf4j;

/**
 * Service for searching subjects across the datasets of the graph.
 * Validation completes before the graph store is contacted.
 */
@Slf4j
@Service
public class QueryService {

  @Autowired
  private CriteriaValidator criteriaValidator;
  @Autowired
  private SubjectQueryBuilder queryBuilder;
  @Autowired
  private GraphStore graphStore;
  @Autowired
  private ResultAggregator resultAggregator;

  /**
   * Get the datasets with subjects matching the given parameters.
   *
   * @param params raw search parameters
   * @return one entry per dataset with at least one matching subject, possibly none
   */
  public List<DatasetMatch> search(SearchParameters params) {
    log.debug("search.enter; got params: {}", params);
    SearchCriteria criteria = criteriaValidator.validate(params);
    SubjectQuery query = queryBuilder.build(criteria);
    List<SubjectRow> rows = graphStore.querySubjects(query);
    List<DatasetMatch> matches = resultAggregator.aggregate(rows);
    log.debug("search.exit; returning {} datasets from {} rows", matches.size(), rows.size());
    return matches;
  }
}
