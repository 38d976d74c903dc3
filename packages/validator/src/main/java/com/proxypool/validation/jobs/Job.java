package com.proxypool.validation.jobs;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A batch of probe targets plus its lifecycle metadata; the unit of lease and assignment.
 *
 * <p>Instances held by the {@link JobStore} are only mutated under the store lock. Everything
 * handed out of the store is a {@link #copy()}, so callers never observe or change live state.
 *
 * <p>Invariants: {@code owner} is set while {@link JobStatus#IN_PROGRESS}; {@code results} is
 * non-null if and only if the status is terminal.
 *
 * @param <T> target record type, opaque to the coordinator
 * @param <R> probe result type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Job<T, R> {
  public static final int DEFAULT_TIMEOUT_SECONDS = 300;

  private final String id;
  private final List<T> targets;
  private final Instant createdAt;
  private final int timeoutSeconds;

  private JobStatus status;
  private String owner;
  private Instant startedAt;
  private Instant completedAt;
  private List<R> results;
  private String errorMessage;

  Job(List<T> targets, int timeoutSeconds, Instant createdAt) {
    this(
        UUID.randomUUID().toString(),
        targets,
        JobStatus.PENDING,
        null,
        createdAt,
        null,
        null,
        null,
        null,
        timeoutSeconds);
  }

  @JsonCreator
  public Job(
      @JsonProperty("job_id") String id,
      @JsonProperty("targets") List<T> targets,
      @JsonProperty("status") JobStatus status,
      @JsonProperty("worker_id") String owner,
      @JsonProperty("created_at") Instant createdAt,
      @JsonProperty("started_at") Instant startedAt,
      @JsonProperty("completed_at") Instant completedAt,
      @JsonProperty("results") List<R> results,
      @JsonProperty("error_message") String errorMessage,
      @JsonProperty("timeout_seconds") int timeoutSeconds) {
    this.id = Objects.requireNonNull(id, "job_id");
    this.targets = immutable(targets);
    this.status = status == null ? JobStatus.PENDING : status;
    this.owner = owner;
    this.createdAt = createdAt;
    this.startedAt = startedAt;
    this.completedAt = completedAt;
    this.results = results == null ? null : immutable(results);
    this.errorMessage = errorMessage;
    this.timeoutSeconds = timeoutSeconds > 0 ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
  }

  @JsonProperty("job_id")
  public String id() {
    return id;
  }

  @JsonProperty("targets")
  public List<T> targets() {
    return targets;
  }

  @JsonProperty("status")
  public JobStatus status() {
    return status;
  }

  @JsonProperty("worker_id")
  public String owner() {
    return owner;
  }

  @JsonProperty("created_at")
  public Instant createdAt() {
    return createdAt;
  }

  @JsonProperty("started_at")
  public Instant startedAt() {
    return startedAt;
  }

  @JsonProperty("completed_at")
  public Instant completedAt() {
    return completedAt;
  }

  @JsonProperty("results")
  public List<R> results() {
    return results;
  }

  @JsonProperty("error_message")
  public String errorMessage() {
    return errorMessage;
  }

  @JsonProperty("timeout_seconds")
  public int timeoutSeconds() {
    return timeoutSeconds;
  }

  // ---------------------------------------------------------------------------------------------
  // Transitions, only called by JobStore under its lock
  // ---------------------------------------------------------------------------------------------

  void markLeased(String workerId, Instant now) {
    if (status != JobStatus.PENDING) {
      throw new IllegalStateException("Job " + id + " cannot be leased from status " + status);
    }
    this.status = JobStatus.IN_PROGRESS;
    this.owner = workerId;
    this.startedAt = now;
  }

  void markFinished(List<R> results, String errorMessage, Instant now) {
    if (status != JobStatus.IN_PROGRESS) {
      throw new IllegalStateException("Job " + id + " cannot finish from status " + status);
    }
    this.results = immutable(results);
    this.errorMessage = errorMessage == null || errorMessage.isBlank() ? null : errorMessage;
    this.status = this.errorMessage == null ? JobStatus.COMPLETED : JobStatus.FAILED;
    this.completedAt = now;
  }

  boolean isLeaseExpired(Instant now) {
    return status == JobStatus.IN_PROGRESS
        && startedAt != null
        && now.isAfter(startedAt.plusSeconds(timeoutSeconds));
  }

  /** A fresh PENDING job over the same targets, with a new id. */
  Job<T, R> retry(Instant now) {
    return new Job<>(targets, timeoutSeconds, now);
  }

  Job<T, R> copy() {
    return new Job<>(
        id,
        targets,
        status,
        owner,
        createdAt,
        startedAt,
        completedAt,
        results,
        errorMessage,
        timeoutSeconds);
  }

  private static <E> List<E> immutable(List<E> source) {
    return source == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(source));
  }

  @Override
  public String toString() {
    return "Job{id=%s, status=%s, owner=%s, targets=%d}"
        .formatted(id, status, owner, targets.size());
  }
}
