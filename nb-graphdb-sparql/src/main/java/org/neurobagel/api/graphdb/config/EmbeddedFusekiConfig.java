package org.neurobagel.api.graphdb.config;

import java.io.IOException;
import java.io.InputStream;

import org.apache.jena.fuseki.main.FusekiServer;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.system.Txn;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

import org.neurobagel.api.core.service.graphdb.CredentialProvider;
import org.neurobagel.api.graphdb.service.SparqlEndpoint;
import org.neurobagel.api.graphdb.service.StaticCredentialProvider;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory Fuseki server standing in for the graph store, optionally loaded with Turtle data.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(value = "neurobagel.scope", havingValue = "test")
public class EmbeddedFusekiConfig {

    @Bean(destroyMethod = "stop")
    public FusekiServer fusekiServer(@Value("${graphstore.embedded.data:}") String dataLocation,
                                     ResourceLoader resourceLoader) throws IOException {
        log.info("starting Embedded Fuseki Server");
        Dataset dataset = DatasetFactory.createTxnMem();
        if (StringUtils.hasText(dataLocation)) {
            Resource resource = resourceLoader.getResource(dataLocation);
            try (InputStream in = resource.getInputStream()) {
                Txn.executeWrite(dataset, () -> RDFDataMgr.read(dataset, in, Lang.TURTLE));
            }
            log.info("loaded {} into Embedded Fuseki Server", dataLocation);
        }
        FusekiServer server = FusekiServer.create()
            .add("/ds", dataset)
            .port(0)
            .build();
        server.start();
        log.info("started Embedded Fuseki Server at {}", server.serverURL());
        return server;
    }

    @Bean
    public SparqlEndpoint sparqlEndpoint(FusekiServer server,
                                         @Value("${graphstore.query-timeout:30}") long timeout) {
        return new SparqlEndpoint(server.serverURL() + "ds", timeout);
    }

    @Bean
    public CredentialProvider credentialProvider() {
        return new StaticCredentialProvider("embedded");
    }
}
