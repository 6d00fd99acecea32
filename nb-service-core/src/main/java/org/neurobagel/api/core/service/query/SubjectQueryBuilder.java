package org.neurobagel.api.core.service.query;

import java.util.ArrayList;
import java.util.List;

import org.apache.jena.query.ParameterizedSparqlString;
import org.apache.jena.query.QueryParseException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import org.neurobagel.api.core.exception.QueryException;
import org.neurobagel.api.core.pojo.Criterion;
import org.neurobagel.api.core.pojo.SearchCriteria;
import org.neurobagel.api.core.pojo.SubjectQuery;
import org.neurobagel.api.core.util.PrefixRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates {@link SearchCriteria} into a SPARQL query over the Neurobagel graph.
 *
 * <p>The base pattern matches every subject session with an imaging acquisition. Annotations are
 * attached as OPTIONAL patterns so that subjects lacking one are not excluded unless that criterion
 * is set. Each present criterion then adds exactly one FILTER. Values are bound through
 * {@link ParameterizedSparqlString}, never concatenated into the query text.</p>
 */
@Slf4j
@Component
public class SubjectQueryBuilder {

  static final String HEALTHY_CONTROL = "purl:NCIT_C94342";

  private static final String SELECT = """
      SELECT DISTINCT ?dataset ?dataset_name ?subject ?sub_id ?file_path ?image_modal ?num_sessions
      WHERE {
        ?dataset a nb:Dataset ;
            nb:hasLabel ?dataset_name ;
            nb:hasSamples ?subject .
        ?subject a nb:Subject ;
            nb:hasLabel ?sub_id ;
            nb:hasSession ?session .
        ?session nb:hasFilePath ?file_path ;
            nb:hasAcquisition/nb:hasContrastType ?image_modal .
        OPTIONAL { ?subject nb:hasAge ?age . }
        OPTIONAL { ?subject nb:hasSex ?sex . }
        OPTIONAL { ?subject nb:hasDiagnosis ?diagnosis . }
        OPTIONAL { ?subject nb:isSubjectGroup ?subject_group . }
        OPTIONAL { ?subject nb:hasAssessment ?assessment . }
        {
          SELECT ?subject (COUNT(DISTINCT ?imaging_session) AS ?num_sessions)
          WHERE {
            ?subject a nb:Subject ;
                nb:hasSession ?imaging_session .
            ?imaging_session nb:hasAcquisition/nb:hasContrastType ?any_modal .
          }
          GROUP BY ?subject
        }
      """;

  private static final List<CriterionClause> CLAUSES = List.of(
      new CriterionClause(Criterion.AGE,
          c -> c.getMinAge() != null || c.getMaxAge() != null,
          SubjectQueryBuilder::appendAgeFilter),
      new CriterionClause(Criterion.SEX,
          c -> c.getSex() != null,
          (q, c) -> {
            q.append("  FILTER (?sex = ?sex_label)\n");
            q.setLiteral("sex_label", c.getSex().getLabel());
          }),
      new CriterionClause(Criterion.DIAGNOSIS,
          c -> c.getDiagnosis() != null,
          (q, c) -> {
            q.append("  FILTER (?diagnosis = ?diagnosis_term)\n");
            q.setIri("diagnosis_term", c.getDiagnosis().iri());
          }),
      new CriterionClause(Criterion.IS_CONTROL,
          c -> c.getIsControl() != null,
          (q, c) -> q.append(c.getIsControl()
              ? "  FILTER (?subject_group = " + HEALTHY_CONTROL + ")\n"
              : "  FILTER (!BOUND(?subject_group) || ?subject_group != " + HEALTHY_CONTROL + ")\n")),
      new CriterionClause(Criterion.MIN_NUM_SESSIONS,
          c -> c.getMinNumSessions() != null,
          (q, c) -> {
            q.append("  FILTER (?num_sessions >= ?min_sessions)\n");
            q.setLiteral("min_sessions", c.getMinNumSessions().intValue());
          }),
      new CriterionClause(Criterion.ASSESSMENT,
          c -> c.getAssessment() != null,
          (q, c) -> {
            q.append("  FILTER (?assessment = ?assessment_term)\n");
            q.setIri("assessment_term", c.getAssessment().iri());
          }),
      new CriterionClause(Criterion.IMAGE_MODAL,
          c -> c.getImageModal() != null,
          (q, c) -> {
            q.append("  FILTER (?image_modal = ?image_modal_term)\n");
            q.setIri("image_modal_term", c.getImageModal().iri());
          }));

  private final String prologue;

  @Autowired
  public SubjectQueryBuilder(PrefixRegistry prefixRegistry) {
    StringBuilder sb = new StringBuilder();
    prefixRegistry.asMap().forEach((prefix, ns) -> sb.append("PREFIX ").append(prefix).append(": <").append(ns).append(">\n"));
    this.prologue = sb.toString();
  }

  /**
   * Builds the subject query for the given criteria.
   *
   * @param criteria validated criteria; null fields are left unconstrained
   * @return the query text with the criteria that constrained it
   * @throws QueryException if the resulting text is not valid SPARQL
   */
  public SubjectQuery build(SearchCriteria criteria) {
    log.debug("build.enter; got criteria: {}", criteria);
    ParameterizedSparqlString query = new ParameterizedSparqlString();
    // declared as text so that bound term IRIs are written out in full
    query.append(prologue);
    query.append(SELECT);
    List<Criterion> applied = new ArrayList<>();
    for (CriterionClause clause : CLAUSES) {
      if (clause.appliesTo(criteria)) {
        clause.appendTo(query, criteria);
        applied.add(clause.criterion());
      }
    }
    query.append("}\n");
    try {
      query.asQuery();
    } catch (QueryParseException e) {
      log.error("build; produced invalid query: {}", query, e);
      throw new QueryException("could not build subject query: " + e.getMessage(), e);
    }
    SubjectQuery result = new SubjectQuery(query.toString(), applied);
    log.debug("build.exit; constraints: {}", applied);
    return result;
  }

  private static void appendAgeFilter(ParameterizedSparqlString query, SearchCriteria criteria) {
    List<String> bounds = new ArrayList<>(2);
    if (criteria.getMinAge() != null) {
      bounds.add("?age >= ?min_age_bound");
      query.setLiteral("min_age_bound", criteria.getMinAge().doubleValue());
    }
    if (criteria.getMaxAge() != null) {
      bounds.add("?age <= ?max_age_bound");
      query.setLiteral("max_age_bound", criteria.getMaxAge().doubleValue());
    }
    query.append("  FILTER (" + String.join(" && ", bounds) + ")\n");
  }
}
