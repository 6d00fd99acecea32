package org.neurobagel.api.core.service.criteria;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import org.neurobagel.api.core.exception.ConflictingCriteriaException;
import org.neurobagel.api.core.exception.CriteriaValidationException;
import org.neurobagel.api.core.exception.InvalidCriterionException;
import org.neurobagel.api.core.exception.MalformedTermException;
import org.neurobagel.api.core.exception.UnknownPrefixException;
import org.neurobagel.api.core.pojo.SearchCriteria;
import org.neurobagel.api.core.pojo.SearchParameters;
import org.neurobagel.api.core.pojo.Sex;
import org.neurobagel.api.core.util.PrefixRegistry;
import org.neurobagel.api.core.util.TermValidator;

class CriteriaValidatorTest {

  private final CriteriaValidator validator = new CriteriaValidator(
      new TermValidator(PrefixRegistry.defaultRegistry()),
      List.of(new AgeRangeRule(), new ControlDiagnosisRule()));

  @Test
  void validate_noParameters_returnsUnconstrainedCriteria() {
    SearchCriteria criteria = validator.validate(SearchParameters.builder().build());

    assertEquals(SearchCriteria.unconstrained(), criteria);
  }

  @Test
  void validate_blankParameters_countAsAbsent() {
    SearchCriteria criteria = validator.validate(SearchParameters.builder()
        .minAge("").sex(" ").diagnosis("").isControl("").minNumSessions("").imageModal(" ").build());

    assertEquals(SearchCriteria.unconstrained(), criteria);
  }

  @ParameterizedTest
  @CsvSource({"30.5, 60", "23, 23", "0, 0.5"})
  void validate_validAgeRange_isAccepted(String min, String max) {
    SearchCriteria criteria = validator.validate(SearchParameters.builder().minAge(min).maxAge(max).build());

    assertEquals(Double.parseDouble(min), criteria.getMinAge());
    assertEquals(Double.parseDouble(max), criteria.getMaxAge());
  }

  @Test
  void validate_singleAgeBound_isAccepted() {
    assertEquals(20.75, validator.validate(SearchParameters.builder().minAge("20.75").build()).getMinAge());
    assertEquals(50.0, validator.validate(SearchParameters.builder().maxAge("50").build()).getMaxAge());
  }

  @Test
  void validate_minAgeAboveMaxAge_throwsConflictingCriteriaException() {
    ConflictingCriteriaException ex = assertThrows(ConflictingCriteriaException.class,
        () -> validator.validate(SearchParameters.builder().minAge("33").maxAge("21").build()));

    assertTrue(ex.getMessage().contains("min_age"));
  }

  @ParameterizedTest
  @CsvSource({"forty, fifty", "-42.5, -40", "NaN, 40", "1e3, 2e3", "30d, 40"})
  void validate_invalidAges_throwInvalidCriterionException(String min, String max) {
    InvalidCriterionException ex = assertThrows(InvalidCriterionException.class,
        () -> validator.validate(SearchParameters.builder().minAge(min).maxAge(max).build()));

    assertEquals("min_age", ex.getField());
  }

  @Test
  void validate_overflowingAge_throwsInvalidCriterionException() {
    String huge = "1" + "0".repeat(400);

    InvalidCriterionException min = assertThrows(InvalidCriterionException.class,
        () -> validator.validate(SearchParameters.builder().minAge(huge).build()));
    InvalidCriterionException max = assertThrows(InvalidCriterionException.class,
        () -> validator.validate(SearchParameters.builder().minAge("20").maxAge(huge).build()));

    assertEquals("min_age", min.getField());
    assertEquals("max_age", max.getField());
    assertTrue(min.getMessage().contains("finite"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"male", "female", "other"})
  void validate_validSex_isAccepted(String sex) {
    SearchCriteria criteria = validator.validate(SearchParameters.builder().sex(sex).build());

    assertEquals(sex, criteria.getSex().getLabel());
  }

  @ParameterizedTest
  @ValueSource(strings = {"apple", "Male", "FEMALE", "m"})
  void validate_invalidSex_throwsInvalidCriterionException(String sex) {
    InvalidCriterionException ex = assertThrows(InvalidCriterionException.class,
        () -> validator.validate(SearchParameters.builder().sex(sex).build()));

    assertEquals("sex", ex.getField());
  }

  @ParameterizedTest
  @CsvSource({"true, true", "True, true", "false, false", "False, false"})
  void validate_validIsControl_isAccepted(String raw, boolean expected) {
    SearchCriteria criteria = validator.validate(SearchParameters.builder().isControl(raw).build());

    assertEquals(expected, criteria.getIsControl());
  }

  @ParameterizedTest
  @ValueSource(strings = {"apple", "1", "yes"})
  void validate_nonBooleanIsControl_throwsInvalidCriterionException(String raw) {
    InvalidCriterionException ex = assertThrows(InvalidCriterionException.class,
        () -> validator.validate(SearchParameters.builder().isControl(raw).build()));

    assertEquals("is_control", ex.getField());
  }

  @ParameterizedTest
  @ValueSource(strings = {"1", "2", "4", "7"})
  void validate_validMinNumSessions_isAccepted(String raw) {
    SearchCriteria criteria = validator.validate(SearchParameters.builder().minNumSessions(raw).build());

    assertEquals(Integer.valueOf(raw), criteria.getMinNumSessions());
  }

  @ParameterizedTest
  @ValueSource(strings = {"0", "-3", "apple", "2.5", "99999999999"})
  void validate_invalidMinNumSessions_throwsInvalidCriterionException(String raw) {
    InvalidCriterionException ex = assertThrows(InvalidCriterionException.class,
        () -> validator.validate(SearchParameters.builder().minNumSessions(raw).build()));

    assertEquals("min_num_sessions", ex.getField());
  }

  @Test
  void validate_controlWithDiagnosis_throwsConflictingCriteriaException() {
    ConflictingCriteriaException ex = assertThrows(ConflictingCriteriaException.class,
        () -> validator.validate(SearchParameters.builder().diagnosis("snomed:35489007").isControl("True").build()));

    assertTrue(ex.getMessage().contains("cannot both be healthy controls and have a diagnosis"));
  }

  @Test
  void validate_controlOrDiagnosisAlone_isAccepted() {
    assertDoesNotThrow(() -> validator.validate(SearchParameters.builder().isControl("true").build()));
    assertDoesNotThrow(() -> validator.validate(SearchParameters.builder().diagnosis("snomed:35489007").build()));
  }

  @Test
  void validate_nonControlWithDiagnosis_isAccepted() {
    SearchCriteria criteria = validator.validate(
        SearchParameters.builder().diagnosis("snomed:49049000").isControl("false").build());

    assertEquals(Boolean.FALSE, criteria.getIsControl());
    assertEquals("snomed:49049000", criteria.getDiagnosis().toString());
  }

  @ParameterizedTest
  @MethodSource("invalidTerms")
  void validate_invalidTerms_propagateTermValidatorFailure(SearchParameters params,
      Class<? extends CriteriaValidationException> expected, String field) {
    CriteriaValidationException ex = assertThrows(CriteriaValidationException.class,
        () -> validator.validate(params));

    assertInstanceOf(expected, ex);
    assertEquals(field, ex.getField());
  }

  static Stream<Arguments> invalidTerms() {
    return Stream.of(
        Arguments.of(SearchParameters.builder().diagnosis("sn0med:35489007").build(),
            MalformedTermException.class, "diagnosis"),
        Arguments.of(SearchParameters.builder().assessment("cogAtlas-1234").build(),
            MalformedTermException.class, "assessment"),
        Arguments.of(SearchParameters.builder().imageModal("2nim:EEG").build(),
            MalformedTermException.class, "image_modal"),
        Arguments.of(SearchParameters.builder().imageModal("dbo:abstract").build(),
            UnknownPrefixException.class, "image_modal"),
        Arguments.of(SearchParameters.builder().assessment("something:cool").build(),
            UnknownPrefixException.class, "assessment"));
  }

  @Test
  void validate_allFieldsPresent_parsesEveryField() {
    SearchCriteria criteria = validator.validate(SearchParameters.builder()
        .minAge("20").maxAge("80").sex("female").diagnosis("snomed:49049000").isControl("false")
        .minNumSessions("2").assessment("bg:cogAtlas-1234").imageModal("nidm:T1Weighted").build());

    assertEquals(20.0, criteria.getMinAge());
    assertEquals(80.0, criteria.getMaxAge());
    assertEquals(Sex.FEMALE, criteria.getSex());
    assertEquals(Boolean.FALSE, criteria.getIsControl());
    assertEquals(2, criteria.getMinNumSessions());
    assertEquals("http://neurobagel.org/bg/cogAtlas-1234", criteria.getAssessment().iri());
    assertEquals("http://purl.org/nidash/nidm#T1Weighted", criteria.getImageModal().iri());
  }

  @Test
  void validate_runsCrossFieldRulesAfterFieldParsing() {
    CriteriaValidator noRules = new CriteriaValidator(new TermValidator(PrefixRegistry.defaultRegistry()), List.of());

    SearchCriteria criteria = noRules.validate(
        SearchParameters.builder().diagnosis("snomed:35489007").isControl("true").minAge("33").maxAge("21").build());

    assertEquals(Boolean.TRUE, criteria.getIsControl());
    assertNull(criteria.getSex());
  }
}
