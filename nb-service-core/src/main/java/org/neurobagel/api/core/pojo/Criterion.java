package org.neurobagel.api.core.pojo;

/**
 * The independently optional constraints of a subject search, in the order they are applied to a query.
 * Both age bounds form one constraint.
 */
public enum Criterion {
  AGE,
  SEX,
  DIAGNOSIS,
  IS_CONTROL,
  MIN_NUM_SESSIONS,
  ASSESSMENT,
  IMAGE_MODAL
}
