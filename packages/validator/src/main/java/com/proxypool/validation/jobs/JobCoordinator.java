package com.proxypool.validation.jobs;

import com.proxypool.validation.spi.ProbeOutcome;
import com.proxypool.validation.spi.ResultSink;
import com.proxypool.validation.spi.TargetSource;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Central authority of a validation run: batches targets into jobs, leases them to workers,
 * accepts completions and periodically sweeps expired leases and silent workers.
 *
 * <p>State lives in a {@link JobStore}; this class adds batching, logging, the hand-off to the
 * {@link ResultSink} (always outside the store lock) and the sweep schedule. Both transport
 * bindings call the same instance.
 *
 * <p>Recovery is at-least-once. When a lease expires the job is retired and its targets requeued
 * under a new id; if the original worker still finishes, its completion names an id the store no
 * longer knows and is ignored. The retried job may therefore probe the same targets again and
 * the sink can see those targets twice.
 */
public final class JobCoordinator<T, R extends ProbeOutcome> implements AutoCloseable {
  private static final Logger log =
      com.proxypool.logging.LoggingService.getLogger(JobCoordinator.class);

  private final CoordinatorSettings settings;
  private final TargetSource<T> targetSource;
  private final ResultSink<R> resultSink;
  private final JobStore<T, R> store;
  private final TargetBatcher batcher;

  private final Object lifecycleLock = new Object();
  private ScheduledExecutorService sweeper;

  public JobCoordinator(
      CoordinatorSettings settings, TargetSource<T> targetSource, ResultSink<R> resultSink) {
    this(settings, targetSource, resultSink, Clock.systemUTC());
  }

  public JobCoordinator(
      CoordinatorSettings settings,
      TargetSource<T> targetSource,
      ResultSink<R> resultSink,
      Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.targetSource = Objects.requireNonNull(targetSource, "targetSource");
    this.resultSink = Objects.requireNonNull(resultSink, "resultSink");
    this.store =
        new JobStore<>(clock, settings.maxConcurrentJobs(), settings.completedHistory());
    this.batcher = new TargetBatcher(clock, (int) settings.jobTimeout().toSeconds());
  }

  public CoordinatorSettings settings() {
    return settings;
  }

  /** Batch {@code targets} with the configured batch size and enqueue the jobs. */
  public List<String> createJobs(List<T> targets) {
    return createJobs(targets, settings.batchSize());
  }

  /**
   * Partition {@code targets} into {@code ceil(n / batchSize)} contiguous jobs, enqueue them and
   * return their ids in queue order. An empty list creates and enqueues nothing.
   */
  public List<String> createJobs(List<T> targets, int batchSize) {
    List<Job<T, R>> jobs = batcher.batch(targets, batchSize);
    if (jobs.isEmpty()) {
      log.debug("No targets supplied, no jobs created");
      return List.of();
    }
    enqueue(jobs);
    log.info(
        "Created {} validation jobs for {} targets (batch size: {})",
        jobs.size(),
        targets.size(),
        batchSize);
    return jobs.stream().map(Job::id).toList();
  }

  public void enqueue(List<Job<T, R>> jobs) {
    if (jobs == null || jobs.isEmpty()) return;
    store.enqueue(jobs);
    log.debug("Added {} jobs to queue", jobs.size());
  }

  /**
   * Lease the head of the queue to {@code workerId}. Returns empty when the queue is empty or the
   * active table already holds {@code maxConcurrentJobs} jobs. The worker's liveness is refreshed
   * either way.
   */
  public Optional<Job<T, R>> leaseNextJob(String workerId) {
    Optional<Job<T, R>> job = store.lease(requireWorkerId(workerId));
    job.ifPresent(
        j ->
            log.info(
                "Assigned job {} to worker {} ({} targets)", j.id(), workerId, j.targets().size()));
    return job;
  }

  /**
   * Finish the active job {@code jobId}. Status is COMPLETED when {@code errorMessage} is blank,
   * FAILED otherwise. Unknown or already finished ids are logged and ignored, so repeated calls
   * have the effect of one.
   */
  public void completeJob(String jobId, List<R> results, String errorMessage) {
    List<R> submitted = results == null ? List.of() : results;
    List<R> accepted = submitted.stream().filter(Objects::nonNull).toList();
    if (accepted.size() < submitted.size()) {
      log.warn(
          "Dropping {} null results from completion of job {}",
          submitted.size() - accepted.size(),
          jobId);
    }
    Optional<Job<T, R>> finished = store.complete(jobId, accepted, errorMessage);
    if (finished.isEmpty()) {
      log.warn("Ignoring completion of job {}: not active (unknown, finished or expired)", jobId);
      return;
    }
    Job<T, R> job = finished.get();
    List<R> jobResults = job.results();
    long working = jobResults.stream().filter(ProbeOutcome::isWorking).count();
    if (job.status() == JobStatus.COMPLETED) {
      log.info(
          "Job {} completed by {} in {} ms: {}/{} working",
          job.id(),
          job.owner(),
          elapsedMillis(job),
          working,
          jobResults.size());
    } else {
      log.warn(
          "Job {} failed on {} after {} ms: {} ({} partial results)",
          job.id(),
          job.owner(),
          elapsedMillis(job),
          job.errorMessage(),
          jobResults.size());
    }

    if (!jobResults.isEmpty()) {
      try {
        resultSink.persist(jobResults);
      } catch (RuntimeException e) {
        log.error("Failed to persist {} results of job {}", jobResults.size(), job.id(), e);
      }
    }
  }

  /** Refresh liveness; unknown workers are registered on the fly. */
  public void heartbeat(String workerId) {
    store.heartbeat(requireWorkerId(workerId));
  }

  /**
   * Create or refresh a worker record with its registration metadata.
   *
   * @return the worker id, generated when {@code workerId} is blank
   */
  public String registerWorker(String workerId, Map<String, String> info) {
    String id = StringUtils.isBlank(workerId) ? WorkerIds.generate() : workerId.trim();
    WorkerView view = store.register(id, info);
    log.info("Worker registered: {} from {}", id, view.hostname());
    return id;
  }

  /** Requeue lease-expired jobs under new ids and evict workers with stale heartbeats. */
  public void sweep() {
    for (JobStore.Expiry<T, R> expiry : store.expireLeases()) {
      log.warn(
          "Job {} of worker {} timed out after {}s, requeued as {}",
          expiry.retired().id(),
          expiry.retired().owner(),
          expiry.retired().timeoutSeconds(),
          expiry.replacement().id());
    }
    for (WorkerView worker : store.evictWorkers(settings.workerTimeout())) {
      log.info(
          "Worker {} disconnected (no heartbeat since {})",
          worker.workerId(),
          worker.lastHeartbeat());
    }
  }

  public CoordinatorStats stats() {
    return store.snapshot();
  }

  public Optional<Job<T, R>> job(String jobId) {
    return store.find(jobId);
  }

  public boolean isDrained() {
    return store.isDrained();
  }

  /**
   * Fetch targets from the {@link TargetSource} and enqueue them as jobs.
   *
   * @return number of jobs created; 0 when nothing matched or the source failed
   */
  public int submitValidation(Map<String, String> filter, int limit) {
    List<T> targets;
    try {
      targets = targetSource.fetch(filter == null ? Map.of() : filter, limit);
    } catch (RuntimeException e) {
      log.error("Error fetching targets for filter {} (limit {})", filter, limit, e);
      return 0;
    }
    if (targets == null || targets.isEmpty()) {
      log.info("No targets found matching {}", filter);
      return 0;
    }
    return createJobs(targets).size();
  }

  /** Start the periodic sweep. Calling it more than once has no effect. */
  public void start() {
    synchronized (lifecycleLock) {
      if (sweeper != null) {
        return;
      }
      sweeper =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "validation-sweeper");
                t.setDaemon(true);
                return t;
              });
      long period = settings.sweepInterval().toMillis();
      sweeper.scheduleWithFixedDelay(this::safeSweep, period, period, TimeUnit.MILLISECONDS);
      log.info("Started sweep every {} ms", period);
    }
  }

  public boolean isStarted() {
    synchronized (lifecycleLock) {
      return sweeper != null;
    }
  }

  @Override
  public void close() {
    synchronized (lifecycleLock) {
      if (sweeper == null) {
        return;
      }
      sweeper.shutdownNow();
      sweeper = null;
      log.info("Stopped sweep");
    }
  }

  private void safeSweep() {
    // an exception would cancel every later run of the scheduled task
    try {
      sweep();
    } catch (RuntimeException e) {
      log.error("Sweep failed", e);
    }
  }

  private static String requireWorkerId(String workerId) {
    if (StringUtils.isBlank(workerId)) {
      throw new IllegalArgumentException("workerId must not be blank");
    }
    return workerId;
  }

  private static long elapsedMillis(Job<?, ?> job) {
    if (job.startedAt() == null || job.completedAt() == null) return 0;
    return Duration.between(job.startedAt(), job.completedAt()).toMillis();
  }
}
