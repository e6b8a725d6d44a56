package io.cachesync.core.domain;

import java.util.Map;

public record HealthStatus(boolean healthy, String message, Map<String, Object> details) {

  public HealthStatus {
    details = details == null ? Map.of() : Map.copyOf(details);
  }

  public static HealthStatus healthy(String message, Map<String, Object> details) {
    return new HealthStatus(true, message, details);
  }

  public static HealthStatus unhealthy(String message, Map<String, Object> details) {
    return new HealthStatus(false, message, details);
  }
}
