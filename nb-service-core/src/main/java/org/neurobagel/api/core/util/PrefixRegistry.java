package org.neurobagel.api.core.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed registry of the vocabulary prefixes a compact identifier may use, mapped to their namespaces.
 * The registry is shared by all term categories.
 */
public final class PrefixRegistry {

  public static final String NB = "http://neurobagel.org/vocab/";
  public static final String PURL = "http://purl.obolibrary.org/obo/";

  private static final PrefixRegistry DEFAULT = new PrefixRegistry(defaultNamespaces());

  private final Map<String, String> namespaces;

  public PrefixRegistry(Map<String, String> namespaces) {
    this.namespaces = Collections.unmodifiableMap(new LinkedHashMap<>(namespaces));
  }

  /**
   * @return the registry of vocabularies the Neurobagel graph is annotated with
   */
  public static PrefixRegistry defaultRegistry() {
    return DEFAULT;
  }

  public boolean isKnown(String prefix) {
    return namespaces.containsKey(prefix);
  }

  public Optional<String> namespaceOf(String prefix) {
    return Optional.ofNullable(namespaces.get(prefix));
  }

  /**
   * @return prefix to namespace mappings, in registration order
   */
  public Map<String, String> asMap() {
    return namespaces;
  }

  private static Map<String, String> defaultNamespaces() {
    Map<String, String> ns = new LinkedHashMap<>();
    ns.put("nb", NB);
    ns.put("nbg", "http://neurobagel.org/graph/");
    ns.put("bg", "http://neurobagel.org/bg/");
    ns.put("snomed", "http://purl.bioontology.org/ontology/SNOMEDCT/");
    ns.put("nidm", "http://purl.org/nidash/nidm#");
    ns.put("ncit", "http://ncicb.nci.nih.gov/xml/owl/EVS/Thesaurus.owl#");
    ns.put("purl", PURL);
    ns.put("cogatlas", "https://www.cognitiveatlas.org/task/id/");
    ns.put("owl", "http://www.w3.org/2002/07/owl#");
    ns.put("rdf", "http://www.w3.org/1999/02/22-rdf-syntax-ns#");
    ns.put("rdfs", "http://www.w3.org/2000/01/rdf-schema#");
    ns.put("xsd", "http://www.w3.org/2001/XMLSchema#");
    return ns;
  }
}
