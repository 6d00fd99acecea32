package org.neurobagel.api.core.pojo;

import java.util.List;

/**
 * A SPARQL SELECT over subjects, with the criteria that contributed a constraint to it.
 *
 * @param text        the complete query text, prefixes included
 * @param constraints the constrained criteria, in the order their filters appear
 */
public record SubjectQuery(String text, List<Criterion> constraints) {

  public SubjectQuery {
    constraints = List.copyOf(constraints);
  }
}
