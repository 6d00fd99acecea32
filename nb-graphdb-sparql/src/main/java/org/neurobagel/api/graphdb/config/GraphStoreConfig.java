package org.neurobagel.api.graphdb.config;

import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import org.neurobagel.api.core.exception.ConfigurationException;
import org.neurobagel.api.core.service.graphdb.CredentialProvider;
import org.neurobagel.api.graphdb.service.SparqlEndpoint;
import org.neurobagel.api.graphdb.service.StoreTokenClient;
import org.neurobagel.api.graphdb.service.TokenCredentialProvider;
import lombok.extern.slf4j.Slf4j;

/**
 * Connects to the external graph store. Startup fails when the store credentials are not configured.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GraphStoreProperties.class)
@ConditionalOnProperty(value = "neurobagel.scope", havingValue = "runtime", matchIfMissing = true)
public class GraphStoreConfig {

    static final String MISSING_CREDENTIALS =
        "could not find the USERNAME and / or PASSWORD environment variables";

    @Bean
    public SparqlEndpoint sparqlEndpoint(GraphStoreProperties props) {
        log.info("sparqlEndpoint; graph store query endpoint is {}", props.getUri());
        return new SparqlEndpoint(props.getUri(), props.getQueryTimeout());
    }

    @Bean
    public CredentialProvider credentialProvider(GraphStoreProperties props) {
        if (!StringUtils.hasText(props.getUsername()) || !StringUtils.hasText(props.getPassword())) {
            throw new ConfigurationException(MISSING_CREDENTIALS);
        }
        WebClient webClient = WebClient.builder()
            .baseUrl(props.getTokenUri())
            .defaultHeaders(headers -> headers.setBasicAuth(props.getUsername(), props.getPassword()))
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
        return new TokenCredentialProvider(
            new StoreTokenClient(webClient, Duration.ofSeconds(props.getQueryTimeout())));
    }
}
