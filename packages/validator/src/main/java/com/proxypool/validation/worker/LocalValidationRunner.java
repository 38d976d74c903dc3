package com.proxypool.validation.worker;

import com.proxypool.validation.jobs.CoordinatorStats;
import com.proxypool.validation.jobs.JobCoordinator;
import com.proxypool.validation.spi.ProbeOutcome;
import com.proxypool.validation.spi.TargetProbe;
import com.proxypool.validation.transport.InProcessCoordinatorClient;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntSupplier;

/**
 * Runs a whole validation in this process: the jobs go to the coordinator, {@code workers}
 * in-process workers drain them through the in-process binding, and the run ends once both the
 * queue and the active table are empty. Working counts come from the completed results.
 */
public final class LocalValidationRunner<T, R extends ProbeOutcome> {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(LocalValidationRunner.class);

  private static final Duration MAX_WAIT_STEP = Duration.ofMillis(200);

  private final JobCoordinator<T, R> coordinator;
  private final TargetProbe<T, R> probe;
  private final WorkerSettings settings;
  private final int workers;
  private final Clock clock;

  public LocalValidationRunner(
      JobCoordinator<T, R> coordinator,
      TargetProbe<T, R> probe,
      WorkerSettings settings,
      int workers) {
    this(coordinator, probe, settings, workers, Clock.systemUTC());
  }

  public LocalValidationRunner(
      JobCoordinator<T, R> coordinator,
      TargetProbe<T, R> probe,
      WorkerSettings settings,
      int workers,
      Clock clock) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive: " + workers);
    }
    this.coordinator = coordinator;
    this.probe = probe;
    this.settings = settings;
    this.workers = workers;
    this.clock = clock;
  }

  /** Fetch targets matching {@code filter} from the coordinator's source and validate them. */
  public ValidationSummary run(Map<String, String> filter, int limit) {
    return execute(() -> coordinator.submitValidation(filter, limit));
  }

  /** Validate an explicit list of targets. */
  public ValidationSummary run(List<T> targets) {
    return execute(() -> coordinator.createJobs(targets).size());
  }

  private ValidationSummary execute(IntSupplier submit) {
    long start = clock.millis();
    CoordinatorStats before = coordinator.stats();
    int jobs = submit.getAsInt();
    if (jobs == 0) {
      log.info("Nothing to validate");
      return ValidationSummary.empty(workers);
    }

    boolean ownsSweeper = !coordinator.isStarted();
    if (ownsSweeper) coordinator.start();

    List<ValidationWorker<T, R>> pool = new ArrayList<>(workers);
    List<Thread> threads = new ArrayList<>(workers);
    for (int i = 0; i < workers; i++) {
      String id = "local-worker-" + i;
      InProcessCoordinatorClient<T, R> client = new InProcessCoordinatorClient<>(coordinator);
      ValidationWorker<T, R> worker = new ValidationWorker<>(id, client, probe, settings);
      Thread thread = new Thread(worker, id);
      thread.setDaemon(true);
      pool.add(worker);
      threads.add(thread);
      thread.start();
    }
    log.info("Started {} local workers for {} jobs", workers, jobs);

    try {
      awaitDrained(threads);
    } finally {
      pool.forEach(ValidationWorker::stop);
      joinAll(threads);
      if (ownsSweeper) coordinator.close();
    }

    CoordinatorStats after = coordinator.stats();
    ValidationSummary summary =
        new ValidationSummary(
            after.targetsValidated() - before.targetsValidated(),
            after.workingTargets() - before.workingTargets(),
            jobs,
            clock.millis() - start,
            workers);
    log.info(
        "Local validation finished: {}/{} working ({} jobs, {} ms)",
        summary.working(),
        summary.tested(),
        summary.jobs(),
        summary.durationMillis());
    return summary;
  }

  private void awaitDrained(List<Thread> threads) {
    long step = Math.min(settings.pollInterval().toMillis(), MAX_WAIT_STEP.toMillis());
    while (!coordinator.isDrained()) {
      if (threads.stream().noneMatch(Thread::isAlive)) {
        log.warn("All local workers exited before the queue drained: {}", coordinator.stats());
        return;
      }
      try {
        Thread.sleep(step);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  private static void joinAll(List<Thread> threads) {
    for (Thread thread : threads) {
      try {
        thread.join();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }
}
