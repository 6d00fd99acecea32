package org.neurobagel.api.core.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.neurobagel.api.core.exception.MalformedTermException;
import org.neurobagel.api.core.exception.UnknownPrefixException;
import org.neurobagel.api.core.pojo.CompactIdentifier;
import org.neurobagel.api.core.pojo.TermCategory;

import lombok.extern.slf4j.Slf4j;

/**
 * Validates controlled-vocabulary terms given as compact identifiers.
 *
 * <p>Validation runs in two stages: {@link #checkSyntax} checks the {@code prefix:accession} shape,
 * {@link #checkPrefix} looks the prefix up in the {@link PrefixRegistry}. Whether the term itself exists
 * is not checked here; a well-formed term unknown to the graph simply matches nothing.</p>
 */
@Slf4j
public class TermValidator {

  /* Letters-only prefix, then an accession without whitespace, control characters or characters that would end an IRI. */
  private static final Pattern TERM_PATTERN = Pattern.compile("^([a-zA-Z]+):([^\\s\\p{Cntrl}<>\"{}|\\\\^`]+)$",
      Pattern.UNICODE_CHARACTER_CLASS);

  private final PrefixRegistry registry;

  public TermValidator(PrefixRegistry registry) {
    this.registry = registry;
  }

  /**
   * Validates a term for the given category.
   *
   * @param value    the raw term
   * @param category the criterion the term was given for
   * @return the validated term, expanded against its namespace
   * @throws MalformedTermException if the value is not a compact identifier
   * @throws UnknownPrefixException if the prefix is not registered
   */
  public CompactIdentifier validate(String value, TermCategory category) {
    Matcher matcher = checkSyntax(value, category);
    String prefix = matcher.group(1);
    String namespace = checkPrefix(prefix, value, category);
    return new CompactIdentifier(prefix, matcher.group(2), namespace);
  }

  /**
   * Checks the {@code prefix:accession} shape.
   *
   * @return the successful matcher, with the prefix in group 1 and the accession in group 2
   */
  public Matcher checkSyntax(String value, TermCategory category) {
    Matcher matcher = TERM_PATTERN.matcher(value == null ? "" : value);
    if (!matcher.matches()) {
      log.debug("checkSyntax; malformed {}: {}", category.getParameterName(), value);
      throw new MalformedTermException(category.getParameterName(), value);
    }
    return matcher;
  }

  /**
   * Looks the prefix up in the registry.
   *
   * @return the namespace the prefix stands for
   */
  public String checkPrefix(String prefix, String value, TermCategory category) {
    return registry.namespaceOf(prefix).orElseThrow(() -> {
      log.debug("checkPrefix; unknown prefix in {}: {}", category.getParameterName(), value);
      return new UnknownPrefixException(category.getParameterName(), value, prefix);
    });
  }
}
