package com.proxypool.validation.jobs;

import com.proxypool.exception.ConfigException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Periodically submits revalidation batches to a coordinator. A round is skipped while the previous
 * one is still queued or running, so rounds never pile up behind a slow worker pool.
 */
public final class ValidationScheduler implements AutoCloseable {
  private static final Logger log =
      com.proxypool.logging.LoggingService.getLogger(ValidationScheduler.class);

  private final JobCoordinator<?, ?> coordinator;
  private final Duration interval;
  private final Map<String, String> filter;
  private final int limit;
  private final Object lifecycleLock = new Object();
  private ScheduledExecutorService executor;

  public ValidationScheduler(
      JobCoordinator<?, ?> coordinator, Duration interval, Map<String, String> filter, int limit) {
    if (interval.isZero() || interval.isNegative()) {
      throw new ConfigException("scheduler.interval-minutes must be positive");
    }
    this.coordinator = coordinator;
    this.interval = interval;
    this.filter = Map.copyOf(filter);
    this.limit = limit;
  }

  public static ValidationScheduler fromConfiguration(
      JobCoordinator<?, ?> coordinator, Configuration config) {
    long minutes = config.getLong("scheduler.interval-minutes", 120);
    long olderThan = config.getLong("scheduler.older-than-minutes", 60);
    int limit = config.getInt("scheduler.limit", 1000);
    return new ValidationScheduler(
        coordinator,
        Duration.ofMinutes(minutes),
        Map.of("older_than_minutes", Long.toString(olderThan)),
        limit);
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (executor != null) return;
      executor =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "validation-scheduler");
                t.setDaemon(true);
                return t;
              });
      long period = interval.toMillis();
      executor.scheduleAtFixedRate(this::safeRun, period, period, TimeUnit.MILLISECONDS);
      log.info(
          "Revalidation scheduled every {} minutes with filter {}", interval.toMinutes(), filter);
    }
  }

  /**
   * Run one round now.
   *
   * @return jobs created, 0 when the round was skipped
   */
  public int runOnce() {
    if (!coordinator.isDrained()) {
      log.info("Skipping revalidation round, previous jobs still queued or running");
      return 0;
    }
    int created = coordinator.submitValidation(filter, limit);
    log.info("Revalidation round created {} jobs", created);
    return created;
  }

  private void safeRun() {
    try {
      runOnce();
    } catch (RuntimeException e) {
      log.error("Revalidation round failed", e);
    }
  }

  @Override
  public void close() {
    synchronized (lifecycleLock) {
      if (executor != null) {
        executor.shutdownNow();
        executor = null;
      }
    }
  }
}
