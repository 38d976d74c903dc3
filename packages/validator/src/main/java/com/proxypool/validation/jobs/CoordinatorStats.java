package com.proxypool.validation.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time snapshot of the coordinator, taken under the job store lock. {@link
 * #toJson(ObjectMapper)} and {@link #fromJson(JsonNode)} define the {@code GET /stats} wire shape.
 */
public record CoordinatorStats(
    int queued,
    int active,
    Map<String, WorkerView> workers,
    long jobsCreated,
    long jobsCompleted,
    long jobsFailed,
    long jobsRequeued,
    long targetsValidated,
    long workingTargets,
    Instant startedAt,
    Instant timestamp) {

  public CoordinatorStats {
    workers =
        workers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(workers));
  }

  public int workerCount() {
    return workers.size();
  }

  /** Jobs completed by each worker, the per-worker table of the stats snapshot. */
  public Map<String, Long> perWorkerCounts() {
    Map<String, Long> counts = new LinkedHashMap<>();
    workers.forEach((id, view) -> counts.put(id, view.jobsCompleted()));
    return counts;
  }

  public boolean isDrained() {
    return queued == 0 && active == 0;
  }

  public ObjectNode toJson(ObjectMapper mapper) {
    ObjectNode node = mapper.createObjectNode();
    node.put("queue_size", queued);
    node.put("active_jobs", active);
    node.put("worker_count", workerCount());

    ObjectNode server = node.putObject("server_stats");
    server.put("total_jobs_created", jobsCreated);
    server.put("total_jobs_completed", jobsCompleted);
    server.put("total_jobs_failed", jobsFailed);
    server.put("total_jobs_requeued", jobsRequeued);
    server.put("total_targets_validated", targetsValidated);
    server.put("total_working_targets", workingTargets);
    if (startedAt != null) server.put("server_start_time", startedAt.toString());

    ObjectNode table = node.putObject("workers");
    workers.forEach(
        (id, view) -> {
          ObjectNode w = table.putObject(id);
          w.put("hostname", view.hostname());
          w.put("jobs_completed", view.jobsCompleted());
          w.put("targets_processed", view.targetsProcessed());
          if (view.lastHeartbeat() != null) w.put("last_seen", view.lastHeartbeat().toString());
          if (view.registeredAt() != null) {
            w.put("registered_at", view.registeredAt().toString());
          }
        });
    if (timestamp != null) node.put("timestamp", timestamp.toString());
    return node;
  }

  public static CoordinatorStats fromJson(JsonNode node) {
    JsonNode server = node.path("server_stats");
    Map<String, WorkerView> workers = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = node.path("workers").fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode w = e.getValue();
      workers.put(
          e.getKey(),
          new WorkerView(
              e.getKey(),
              instant(w.path("registered_at")),
              instant(w.path("last_seen")),
              w.path("jobs_completed").asLong(),
              w.path("targets_processed").asLong(),
              Map.of("hostname", w.path("hostname").asText("unknown"))));
    }
    return new CoordinatorStats(
        node.path("queue_size").asInt(),
        node.path("active_jobs").asInt(),
        workers,
        server.path("total_jobs_created").asLong(),
        server.path("total_jobs_completed").asLong(),
        server.path("total_jobs_failed").asLong(),
        server.path("total_jobs_requeued").asLong(),
        server.path("total_targets_validated").asLong(),
        server.path("total_working_targets").asLong(),
        instant(server.path("server_start_time")),
        instant(node.path("timestamp")));
  }

  private static Instant instant(JsonNode node) {
    return node.isTextual() ? Instant.parse(node.asText()) : null;
  }
}
