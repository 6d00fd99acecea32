package org.neurobagel.api.server.health;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import org.neurobagel.api.core.service.graphdb.GraphStore;

/**
 * Spring Boot health indicator for the graph store backend.
 * Reports the query endpoint and whether it answers.
 */
@Component
public class GraphStoreHealthIndicator implements HealthIndicator {

  @Autowired
  private GraphStore graphStore;

  @Override
  public Health health() {
    if (!graphStore.isHealthy()) {
      return Health.down()
          .withDetail("endpoint", graphStore.getLocation())
          .withDetail("reason", "Backend connectivity check failed")
          .build();
    }
    return Health.up()
        .withDetail("endpoint", graphStore.getLocation())
        .build();
  }
}
