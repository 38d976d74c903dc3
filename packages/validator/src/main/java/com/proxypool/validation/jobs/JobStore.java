package com.proxypool.validation.jobs;

import com.proxypool.validation.spi.ProbeOutcome;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory table of pending, active and recently completed jobs plus the worker liveness table.
 *
 * <p>Every mutation happens inside one short critical section on a single lock. Nothing in here
 * performs I/O or calls collaborators. A job lives in the queue or in the active table, never in
 * both; jobs leaving the store are copies.
 */
public final class JobStore<T, R extends ProbeOutcome> {
  static final String LEASE_EXPIRED = "lease expired";

  private final Object lock = new Object();
  private final Clock clock;
  private final int maxConcurrentJobs;
  private final Instant startedAt;

  private final Deque<Job<T, R>> queue = new ArrayDeque<>();
  private final Map<String, Job<T, R>> active = new LinkedHashMap<>();
  private final Map<String, Job<T, R>> completed;
  private final Map<String, WorkerRecord> workers = new LinkedHashMap<>();

  private long jobsCreated;
  private long jobsCompleted;
  private long jobsFailed;
  private long jobsRequeued;
  private long targetsValidated;
  private long workingTargets;

  /** Outcome of retiring one lease-expired job. */
  public record Expiry<T, R>(Job<T, R> retired, Job<T, R> replacement) {}

  public JobStore(Clock clock, int maxConcurrentJobs, int completedHistory) {
    if (maxConcurrentJobs <= 0) {
      throw new IllegalArgumentException(
          "maxConcurrentJobs must be positive: " + maxConcurrentJobs);
    }
    this.clock = clock;
    this.maxConcurrentJobs = maxConcurrentJobs;
    this.startedAt = clock.instant();
    final int historyLimit = Math.max(0, completedHistory);
    this.completed =
        new LinkedHashMap<>() {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, Job<T, R>> eldest) {
            return size() > historyLimit;
          }
        };
  }

  public int maxConcurrentJobs() {
    return maxConcurrentJobs;
  }

  /** Append freshly created jobs to the tail of the queue. */
  public void enqueue(Collection<Job<T, R>> jobs) {
    synchronized (lock) {
      for (Job<T, R> job : jobs) {
        if (job.status() != JobStatus.PENDING) {
          throw new IllegalArgumentException("Only PENDING jobs can be queued: " + job);
        }
        queue.addLast(job);
      }
      jobsCreated += jobs.size();
    }
  }

  /**
   * Record the worker as alive and, when the queue is non-empty and the active table is below the
   * concurrency ceiling, move the head of the queue into the active table on behalf of that worker.
   */
  public Optional<Job<T, R>> lease(String workerId) {
    synchronized (lock) {
      Instant now = clock.instant();
      touch(workerId, now);
      if (queue.isEmpty() || active.size() >= maxConcurrentJobs) {
        return Optional.empty();
      }
      Job<T, R> job = queue.pollFirst();
      job.markLeased(workerId, now);
      active.put(job.id(), job);
      return Optional.of(job.copy());
    }
  }

  /**
   * Finish an active job. Returns empty when the id is not in the active table (unknown, already
   * completed, or retired by the sweep); the call then has no effect.
   */
  public Optional<Job<T, R>> complete(String jobId, List<R> results, String errorMessage) {
    synchronized (lock) {
      Job<T, R> job = jobId == null ? null : active.remove(jobId);
      if (job == null) {
        return Optional.empty();
      }
      job.markFinished(results, errorMessage, clock.instant());

      List<R> finished = job.results();
      long working = finished.stream().filter(r -> r != null && r.isWorking()).count();
      WorkerRecord worker = job.owner() == null ? null : workers.get(job.owner());
      if (worker != null) {
        worker.jobsCompleted++;
        worker.targetsProcessed += finished.size();
      }
      if (job.status() == JobStatus.COMPLETED) {
        jobsCompleted++;
      } else {
        jobsFailed++;
      }
      targetsValidated += finished.size();
      workingTargets += working;
      completed.put(job.id(), job);
      return Optional.of(job.copy());
    }
  }

  /**
   * Retire every active job whose lease is older than its timeout and append a fresh job with the
   * same targets to the queue tail. The retired job is dropped from the store.
   */
  public List<Expiry<T, R>> expireLeases() {
    synchronized (lock) {
      Instant now = clock.instant();
      List<Expiry<T, R>> expired = new ArrayList<>();
      Iterator<Job<T, R>> it = active.values().iterator();
      while (it.hasNext()) {
        Job<T, R> job = it.next();
        if (!job.isLeaseExpired(now)) continue;
        it.remove();
        job.markFinished(List.of(), LEASE_EXPIRED, now);
        Job<T, R> replacement = job.retry(now);
        queue.addLast(replacement);
        jobsRequeued++;
        expired.add(new Expiry<>(job.copy(), replacement.copy()));
      }
      return expired;
    }
  }

  /** Remove workers whose last heartbeat is older than {@code timeout}. */
  public List<WorkerView> evictWorkers(Duration timeout) {
    synchronized (lock) {
      Instant cutoff = clock.instant().minus(timeout);
      List<WorkerView> evicted = new ArrayList<>();
      Iterator<WorkerRecord> it = workers.values().iterator();
      while (it.hasNext()) {
        WorkerRecord worker = it.next();
        if (worker.lastHeartbeat.isBefore(cutoff)) {
          it.remove();
          evicted.add(worker.view());
        }
      }
      return evicted;
    }
  }

  /** Refresh a worker's heartbeat, creating its record when unknown. */
  public void heartbeat(String workerId) {
    synchronized (lock) {
      touch(workerId, clock.instant());
    }
  }

  public WorkerView register(String workerId, Map<String, String> info) {
    synchronized (lock) {
      WorkerRecord worker = touch(workerId, clock.instant());
      worker.updateInfo(info);
      return worker.view();
    }
  }

  public Optional<Job<T, R>> find(String jobId) {
    synchronized (lock) {
      Job<T, R> job = active.get(jobId);
      if (job == null) job = completed.get(jobId);
      if (job == null) {
        for (Job<T, R> queued : queue) {
          if (queued.id().equals(jobId)) {
            job = queued;
            break;
          }
        }
      }
      return Optional.ofNullable(job).map(Job::copy);
    }
  }

  public Optional<WorkerView> worker(String workerId) {
    synchronized (lock) {
      return Optional.ofNullable(workers.get(workerId)).map(WorkerRecord::view);
    }
  }

  public boolean isDrained() {
    synchronized (lock) {
      return queue.isEmpty() && active.isEmpty();
    }
  }

  public CoordinatorStats snapshot() {
    synchronized (lock) {
      Map<String, WorkerView> views = new LinkedHashMap<>();
      workers.forEach((id, record) -> views.put(id, record.view()));
      return new CoordinatorStats(
          queue.size(),
          active.size(),
          views,
          jobsCreated,
          jobsCompleted,
          jobsFailed,
          jobsRequeued,
          targetsValidated,
          workingTargets,
          startedAt,
          clock.instant());
    }
  }

  private WorkerRecord touch(String workerId, Instant now) {
    WorkerRecord worker = workers.computeIfAbsent(workerId, id -> new WorkerRecord(id, now));
    worker.lastHeartbeat = now;
    return worker;
  }
}
