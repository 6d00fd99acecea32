package org.neurobagel.api.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import org.neurobagel.api.core.util.PrefixRegistry;
import org.neurobagel.api.core.util.TermValidator;

/**
 * Query service core configuration: validation, query translation and result aggregation.
 */
@Configuration
@ComponentScan(basePackages = {"org.neurobagel.api.core.service"})
public class CoreConfig {

  @Bean
  public PrefixRegistry prefixRegistry() {
    return PrefixRegistry.defaultRegistry();
  }

  @Bean
  public TermValidator termValidator(PrefixRegistry prefixRegistry) {
    return new TermValidator(prefixRegistry);
  }
}
