package com.proxypool.validation.jobs;

import java.time.Instant;
import java.util.Map;

/** Point-in-time snapshot of a worker's liveness record. */
public record WorkerView(
    String workerId,
    Instant registeredAt,
    Instant lastHeartbeat,
    long jobsCompleted,
    long targetsProcessed,
    Map<String, String> info) {

  public String hostname() {
    return info == null ? "unknown" : info.getOrDefault("hostname", "unknown");
  }
}
