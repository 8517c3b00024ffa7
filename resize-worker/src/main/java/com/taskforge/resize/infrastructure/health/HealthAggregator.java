package com.taskforge.resize.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the reachability of every registered {@link HealthCheckable}.
 */
@Component
public class HealthAggregator {
  private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

  public record Report(String status, Map<String, String> services) {
    public boolean healthy() { return "Healthy".equals(status); }
  }

  private final List<HealthCheckable> dependencies;

  public HealthAggregator(List<HealthCheckable> dependencies) {
    this.dependencies = List.copyOf(dependencies);
  }

  public Report check() {
    Map<String, String> services = new LinkedHashMap<>();
    boolean healthy = true;
    for (HealthCheckable d : dependencies) {
      boolean up = d.isHealthy();
      if (!up) {
        log.info("{} is not healthy", d.name());
        healthy = false;
      }
      services.put(d.name(), up ? "UP" : "DOWN");
    }
    return new Report(healthy ? "Healthy" : "Unhealthy", services);
  }
}
