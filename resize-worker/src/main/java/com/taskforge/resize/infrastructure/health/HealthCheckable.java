package com.taskforge.resize.infrastructure.health;

/**
 * A process-owned dependency that can report its own reachability.
 */
public interface HealthCheckable {
  /** Key under which the dependency is reported, e.g. {@code redis}. */
  String name();

  boolean isHealthy();
}
