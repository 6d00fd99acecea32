package org.neurobagel.api.core.pojo;

/**
 * A validated {@code prefix:accession} term together with the namespace its prefix stands for.
 */
public record CompactIdentifier(String prefix, String accession, String namespace) {

  /**
   * @return the full IRI of the term
   */
  public String iri() {
    return namespace + accession;
  }

  @Override
  public String toString() {
    return prefix + ":" + accession;
  }
}
