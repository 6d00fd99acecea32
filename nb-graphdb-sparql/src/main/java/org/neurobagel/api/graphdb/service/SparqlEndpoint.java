package org.neurobagel.api.graphdb.service;

/**
 * Location of the SPARQL query service and the transport timeout applied to each query.
 *
 * @param queryUri       SPARQL query endpoint
 * @param timeoutSeconds query timeout in seconds
 */
public record SparqlEndpoint(String queryUri, long timeoutSeconds) {
}
