package com.proxypool.validation.jobs;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Liveness entry for one worker. Only touched by {@link JobStore} under its lock. */
final class WorkerRecord {
  final String id;
  final Instant registeredAt;
  Instant lastHeartbeat;
  long jobsCompleted;
  long targetsProcessed;
  Map<String, String> info = Map.of();

  WorkerRecord(String id, Instant now) {
    this.id = id;
    this.registeredAt = now;
    this.lastHeartbeat = now;
  }

  void updateInfo(Map<String, String> info) {
    if (info == null || info.isEmpty()) return;
    Map<String, String> copy = new LinkedHashMap<>();
    info.forEach(
        (k, v) -> {
          if (k != null && v != null) copy.put(k, v);
        });
    this.info = Collections.unmodifiableMap(copy);
  }

  WorkerView view() {
    return new WorkerView(id, registeredAt, lastHeartbeat, jobsCompleted, targetsProcessed, info);
  }
}
