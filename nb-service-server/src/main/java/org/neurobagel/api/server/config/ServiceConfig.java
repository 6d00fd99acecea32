package org.neurobagel.api.server.config;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import org.neurobagel.api.core.config.CoreConfig;

/**
 * Query service configuration: the core plus the SPARQL graph store.
 */
@Configuration
@Import(value = {CoreConfig.class})
@ComponentScan(basePackages = {"org.neurobagel.api.graphdb.service", "org.neurobagel.api.graphdb.config"})
public class ServiceConfig {

}
