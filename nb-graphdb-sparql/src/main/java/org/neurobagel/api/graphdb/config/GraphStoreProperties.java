package org.neurobagel.api.graphdb.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Location of and credentials for the external graph store.
 */
@Getter
@Setter
@ToString(exclude = "password")
@ConfigurationProperties(prefix = "graphstore")
public class GraphStoreProperties {

    /** SPARQL query endpoint of the graph database. */
    private String uri;
    /** Endpoint issuing bearer tokens against basic authentication. */
    private String tokenUri;
    private String username;
    private String password;
    /** Query timeout in seconds. */
    private long queryTimeout = 30;
}
