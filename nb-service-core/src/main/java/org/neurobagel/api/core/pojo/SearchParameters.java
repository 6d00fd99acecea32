package org.neurobagel.api.core.pojo;

/**
 * Raw, unvalidated search parameters exactly as received from the caller. Any of them may be null.
 */
@lombok.Value
@lombok.Builder
public class SearchParameters {
  String minAge;
  String maxAge;
  String sex;
  String diagnosis;
  String isControl;
  String minNumSessions;
  String assessment;
  String imageModal;
}
