package org.neurobagel.api.core.service.criteria;

import java.util.List;
import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import org.neurobagel.api.core.exception.CriteriaValidationException;
import org.neurobagel.api.core.exception.InvalidCriterionException;
import org.neurobagel.api.core.pojo.CompactIdentifier;
import org.neurobagel.api.core.pojo.SearchCriteria;
import org.neurobagel.api.core.pojo.SearchParameters;
import org.neurobagel.api.core.pojo.Sex;
import org.neurobagel.api.core.pojo.TermCategory;
import org.neurobagel.api.core.util.TermValidator;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns raw search parameters into {@link SearchCriteria}.
 *
 * <p>Every field is parsed on its own first. The {@link CrossFieldRule}s then run over the parsed value,
 * so rules spanning several fields never interleave with field parsing. The first failure is reported.</p>
 */
@Slf4j
@Component
public class CriteriaValidator {

  private static final Pattern DECIMAL = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)$");
  private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

  private final TermValidator termValidator;
  private final List<CrossFieldRule> crossFieldRules;

  @Autowired
  public CriteriaValidator(TermValidator termValidator, List<CrossFieldRule> crossFieldRules) {
    this.termValidator = termValidator;
    this.crossFieldRules = List.copyOf(crossFieldRules);
  }

  /**
   * Validates raw parameters. Blank parameters count as absent.
   *
   * @param params raw request parameters
   * @return the parsed criteria
   * @throws CriteriaValidationException describing the first offending field or rule
   */
  public SearchCriteria validate(SearchParameters params) {
    log.debug("validate.enter; got params: {}", params);
    SearchCriteria criteria = SearchCriteria.builder()
        .minAge(parseAge(params.getMinAge(), "min_age"))
        .maxAge(parseAge(params.getMaxAge(), "max_age"))
        .sex(parseSex(params.getSex()))
        .diagnosis(parseTerm(params.getDiagnosis(), TermCategory.DIAGNOSIS))
        .isControl(parseBoolean(params.getIsControl(), "is_control"))
        .minNumSessions(parseSessionCount(params.getMinNumSessions()))
        .assessment(parseTerm(params.getAssessment(), TermCategory.ASSESSMENT))
        .imageModal(parseTerm(params.getImageModal(), TermCategory.IMAGE_MODAL))
        .build();
    crossFieldRules.forEach(rule -> rule.check(criteria));
    log.debug("validate.exit; returning: {}", criteria);
    return criteria;
  }

  private Double parseAge(String raw, String field) {
    if (isAbsent(raw)) {
      return null;
    }
    String value = raw.trim();
    if (!DECIMAL.matcher(value).matches()) {
      throw new InvalidCriterionException(field, field + " must be a number, got '" + raw + "'.");
    }
    double age = Double.parseDouble(value);
    if (!Double.isFinite(age)) {
      throw new InvalidCriterionException(field, field + " must be a finite number, got '" + raw + "'.");
    }
    if (age < 0) {
      throw new InvalidCriterionException(field, field + " must be non-negative, got " + raw + ".");
    }
    return age;
  }

  private Sex parseSex(String raw) {
    if (isAbsent(raw)) {
      return null;
    }
    return Sex.fromLabel(raw.trim()).orElseThrow(() -> new InvalidCriterionException("sex",
        "sex must be one of male, female or other, got '" + raw + "'."));
  }

  private Boolean parseBoolean(String raw, String field) {
    if (isAbsent(raw)) {
      return null;
    }
    String value = raw.trim();
    if ("true".equalsIgnoreCase(value)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(value)) {
      return Boolean.FALSE;
    }
    throw new InvalidCriterionException(field, field + " must be true or false, got '" + raw + "'.");
  }

  private Integer parseSessionCount(String raw) {
    if (isAbsent(raw)) {
      return null;
    }
    String value = raw.trim();
    int sessions;
    try {
      if (!INTEGER.matcher(value).matches()) {
        throw new NumberFormatException(value);
      }
      sessions = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new InvalidCriterionException("min_num_sessions",
          "min_num_sessions must be an integer, got '" + raw + "'.");
    }
    if (sessions < 1) {
      throw new InvalidCriterionException("min_num_sessions",
          "min_num_sessions must be at least 1, got " + sessions + ".");
    }
    return sessions;
  }

  private CompactIdentifier parseTerm(String raw, TermCategory category) {
    if (isAbsent(raw)) {
      return null;
    }
    return termValidator.validate(raw.trim(), category);
  }

  private static boolean isAbsent(String raw) {
    return raw == null || raw.isBlank();
  }
}
