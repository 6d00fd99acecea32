package org.neurobagel.api.core.pojo;

/**
 * Validated search criteria. A null field means the criterion is unconstrained.
 */
@lombok.Value
@lombok.Builder
public class SearchCriteria {
  Double minAge;
  Double maxAge;
  Sex sex;
  CompactIdentifier diagnosis;
  Boolean isControl;
  Integer minNumSessions;
  CompactIdentifier assessment;
  CompactIdentifier imageModal;

  public static SearchCriteria unconstrained() {
    return SearchCriteria.builder().build();
  }
}
