package com.proxypool.validation.worker;

import com.proxypool.exception.ExceptionUtil;
import com.proxypool.validation.jobs.Job;
import com.proxypool.validation.jobs.WorkerIds;
import com.proxypool.validation.spi.ProbeOutcome;
import com.proxypool.validation.spi.TargetProbe;
import com.proxypool.validation.transport.CoordinatorClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.lang3.StringUtils;

/**
 * Pulls jobs from a coordinator and probes their targets.
 *
 * <p>The loop is: heartbeat, request a job, sleep for the poll interval when none is available,
 * otherwise probe every target on a fixed pool of {@code concurrency} threads and report the
 * results. A failed probe is a result, not an error. Heartbeat and submission failures are logged
 * and swallowed; the coordinator's sweep recovers a job whose results never arrive. Failed lease
 * requests and jobs whose processing throws are counted: each consecutive failure doubles the
 * wait, and at {@code maxConsecutiveFailures} the worker gives up and ends in {@link
 * WorkerState#TERMINATED}. A job whose processing throws is reported as a failed batch first.
 *
 * <p>The same class runs in-process and networked; only the {@link CoordinatorClient} differs.
 */
public final class ValidationWorker<T, R extends ProbeOutcome> implements Runnable, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(ValidationWorker.class);

  private final String workerId;
  private final CoordinatorClient<T, R> client;
  private final TargetProbe<T, R> probe;
  private final WorkerSettings settings;
  private final ExecutorService probePool;
  private final ScheduledExecutorService keepAlive;
  private final CountDownLatch stopSignal = new CountDownLatch(1);

  private volatile WorkerState state = WorkerState.CREATED;
  private final AtomicLong jobsProcessed = new AtomicLong();
  private final AtomicLong targetsProcessed = new AtomicLong();
  private int consecutiveFailures;

  public ValidationWorker(
      String workerId,
      CoordinatorClient<T, R> client,
      TargetProbe<T, R> probe,
      WorkerSettings settings) {
    this.workerId = StringUtils.isBlank(workerId) ? WorkerIds.generate() : workerId.trim();
    this.client = Objects.requireNonNull(client, "client");
    this.probe = Objects.requireNonNull(probe, "probe");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.probePool =
        Executors.newFixedThreadPool(settings.concurrency(), threads(this.workerId + "-probe"));
    this.keepAlive =
        Executors.newSingleThreadScheduledExecutor(threads(this.workerId + "-heartbeat"));
  }

  public String workerId() {
    return workerId;
  }

  public WorkerState state() {
    return state;
  }

  public long jobsProcessed() {
    return jobsProcessed.get();
  }

  public long targetsProcessed() {
    return targetsProcessed.get();
  }

  /** Lease the next job. Transport failures propagate to the caller. */
  public Optional<Job<T, R>> requestJob() {
    return client.leaseNextJob(workerId);
  }

  /**
   * Probe every target of {@code job} with bounded concurrency. Results are in target order, one
   * per target. Only a failure outside the individual probes turns into a batch error, reported
   * together with the results gathered so far: the pool rejecting work, an interrupt, or a
   * {@link TargetProbe#failure} mapping that throws or returns {@code null}.
   */
  public JobOutcome<R> runJob(Job<T, R> job) {
    List<T> targets = job.targets();
    List<Future<R>> pending = new ArrayList<>(targets.size());
    List<R> results = new ArrayList<>(targets.size());
    try {
      for (T target : targets) {
        pending.add(probePool.submit(() -> probeTarget(target)));
      }
      for (Future<R> future : pending) {
        results.add(future.get());
      }
      return JobOutcome.success(results);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(pending);
      return JobOutcome.failure(results, "Interrupted while probing job " + job.id());
    } catch (ExecutionException | RuntimeException e) {
      cancel(pending);
      log.error(
          "Job {} failed after {} of {} targets", job.id(), results.size(), targets.size(), e);
      return JobOutcome.failure(results, ExceptionUtil.extractErrorMessage(e));
    }
  }

  /** Report a job outcome. Failures are logged; the sweep recovers an unreported job. */
  public void submitResult(String jobId, JobOutcome<R> outcome) {
    try {
      client.completeJob(jobId, outcome.results(), outcome.errorMessage());
    } catch (RuntimeException e) {
      log.warn(
          "Worker {} could not submit results of job {}: {}",
          workerId,
          jobId,
          ExceptionUtil.extractErrorMessage(e));
    }
  }

  public void sendHeartbeat() {
    try {
      client.heartbeat(workerId);
    } catch (RuntimeException e) {
      log.warn("Heartbeat of worker {} failed: {}", workerId, ExceptionUtil.extractErrorMessage(e));
    }
  }

  /** Register with the coordinator; a failure is logged and the loop proceeds unregistered. */
  public void register() {
    Map<String, String> info = new LinkedHashMap<>();
    info.put("hostname", WorkerIds.hostname());
    info.put("max_concurrent", String.valueOf(settings.concurrency()));
    info.put("poll_interval_ms", String.valueOf(settings.pollInterval().toMillis()));
    String version = ValidationWorker.class.getPackage().getImplementationVersion();
    if (version != null) info.put("version", version);
    try {
      client.registerWorker(workerId, info);
      log.info("Worker {} registered", workerId);
    } catch (RuntimeException e) {
      log.warn(
          "Worker {} could not register, continuing: {}",
          workerId,
          ExceptionUtil.extractErrorMessage(e));
    }
  }

  @Override
  public void run() {
    state = WorkerState.RUNNING;
    log.info("Worker {} started ({} concurrent probes)", workerId, settings.concurrency());
    register();
    try {
      while (stopSignal.getCount() > 0) {
        sendHeartbeat();

        Optional<Job<T, R>> job;
        try {
          job = requestJob();
        } catch (RuntimeException e) {
          if (countFailure(e)) return;
          continue;
        }

        if (job.isEmpty()) {
          consecutiveFailures = 0;
          pause(settings.pollInterval());
          continue;
        }
        Job<T, R> leased = job.get();
        try {
          process(leased);
          consecutiveFailures = 0;
        } catch (RuntimeException e) {
          log.error("Worker {} could not process job {}", workerId, leased.id(), e);
          submitResult(
              leased.id(),
              JobOutcome.failure(
                  List.of(), "Worker error: " + ExceptionUtil.extractErrorMessage(e)));
          if (countFailure(e)) return;
        }
      }
    } finally {
      if (state != WorkerState.TERMINATED) {
        state = WorkerState.STOPPED;
      }
      shutdownPools();
      log.info(
          "Worker {} {} after {} jobs ({} targets)",
          workerId,
          state == WorkerState.TERMINATED ? "terminated" : "stopped",
          jobsProcessed.get(),
          targetsProcessed.get());
    }
  }

  /**
   * Count a loop-level failure and back off. Returns true when the worker has reached {@code
   * maxConsecutiveFailures} and must terminate.
   */
  private boolean countFailure(RuntimeException e) {
    consecutiveFailures++;
    log.warn(
        "Worker {} error #{}: {}",
        workerId,
        consecutiveFailures,
        ExceptionUtil.extractErrorMessage(e));
    if (consecutiveFailures >= settings.maxConsecutiveFailures()) {
      log.error("Worker {} stopping after {} consecutive failures", workerId, consecutiveFailures);
      state = WorkerState.TERMINATED;
      return true;
    }
    pause(settings.backoff(consecutiveFailures));
    return false;
  }

  /** Ask the loop to exit after the current step. The job in flight is still reported. */
  public void stop() {
    stopSignal.countDown();
  }

  @Override
  public void close() {
    stop();
    shutdownPools();
  }

  private void process(Job<T, R> job) {
    log.info("Worker {} processing job {} ({} targets)", workerId, job.id(), job.targets().size());
    long period = settings.heartbeatInterval().toMillis();
    ScheduledFuture<?> ticker =
        keepAlive.scheduleAtFixedRate(this::sendHeartbeat, period, period, TimeUnit.MILLISECONDS);
    JobOutcome<R> outcome;
    try {
      outcome = runJob(job);
    } finally {
      ticker.cancel(false);
    }
    if (outcome.failed()) {
      log.warn(
          "Worker {} reporting job {} as failed: {}", workerId, job.id(), outcome.errorMessage());
    } else {
      long working = outcome.results().stream().filter(ProbeOutcome::isWorking).count();
      log.info(
          "Worker {} finished job {}: {}/{} working",
          workerId,
          job.id(),
          working,
          outcome.results().size());
    }
    submitResult(job.id(), outcome);
    jobsProcessed.incrementAndGet();
    targetsProcessed.addAndGet(outcome.results().size());
  }

  private R probeTarget(T target) {
    try {
      R result = probe.probe(target);
      return result != null
          ? result
          : mapFailure(target, new IllegalStateException("Probe returned no result"));
    } catch (RuntimeException e) {
      log.warn(
          "Probe of {} threw {} at {}",
          target,
          ExceptionUtil.extractErrorMessage(e),
          ExceptionUtil.formatCompactStackTrace(e, 3));
      return mapFailure(target, e);
    }
  }

  private R mapFailure(T target, RuntimeException error) {
    R mapped = probe.failure(target, error);
    if (mapped == null) {
      throw new IllegalStateException("No result for " + target, error);
    }
    return mapped;
  }

  private void pause(Duration delay) {
    try {
      stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      stop();
    }
  }

  private void shutdownPools() {
    probePool.shutdownNow();
    keepAlive.shutdownNow();
  }

  private static void cancel(List<? extends Future<?>> futures) {
    for (Future<?> future : futures) {
      future.cancel(true);
    }
  }

  private static ThreadFactory threads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
