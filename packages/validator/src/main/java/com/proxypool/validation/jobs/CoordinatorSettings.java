package com.proxypool.validation.jobs;

import com.proxypool.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** Tunables of the coordinator, resolved from the {@code coordinator.*} configuration keys. */
public record CoordinatorSettings(
    int batchSize,
    int maxConcurrentJobs,
    Duration jobTimeout,
    Duration workerTimeout,
    Duration sweepInterval,
    int completedHistory) {

  public static final int DEFAULT_BATCH_SIZE = 50;
  public static final int DEFAULT_MAX_CONCURRENT_JOBS = 10;

  public CoordinatorSettings {
    requirePositive("coordinator.batch-size", batchSize);
    requirePositive("coordinator.max-concurrent-jobs", maxConcurrentJobs);
    requirePositive("coordinator.job-timeout-seconds", jobTimeout.toSeconds());
    requirePositive("coordinator.worker-timeout-seconds", workerTimeout.toSeconds());
    requirePositive("coordinator.sweep-interval-seconds", sweepInterval.toMillis());
    if (completedHistory < 0) {
      throw new ConfigException("coordinator.completed-history must not be negative");
    }
  }

  public static CoordinatorSettings defaults() {
    return new CoordinatorSettings(
        DEFAULT_BATCH_SIZE,
        DEFAULT_MAX_CONCURRENT_JOBS,
        Duration.ofSeconds(Job.DEFAULT_TIMEOUT_SECONDS),
        Duration.ofSeconds(300),
        Duration.ofSeconds(30),
        100);
  }

  public static CoordinatorSettings fromConfiguration(Configuration config) {
    CoordinatorSettings d = defaults();
    try {
      return new CoordinatorSettings(
          config.getInt("coordinator.batch-size", d.batchSize()),
          config.getInt("coordinator.max-concurrent-jobs", d.maxConcurrentJobs()),
          Duration.ofSeconds(
              config.getLong("coordinator.job-timeout-seconds", d.jobTimeout().toSeconds())),
          Duration.ofSeconds(
              config.getLong("coordinator.worker-timeout-seconds", d.workerTimeout().toSeconds())),
          Duration.ofSeconds(
              config.getLong("coordinator.sweep-interval-seconds", d.sweepInterval().toSeconds())),
          config.getInt("coordinator.completed-history", d.completedHistory()));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid coordinator configuration", e);
    }
  }

  public CoordinatorSettings withBatchSize(int batchSize) {
    return new CoordinatorSettings(
        batchSize, maxConcurrentJobs, jobTimeout, workerTimeout, sweepInterval, completedHistory);
  }

  public CoordinatorSettings withMaxConcurrentJobs(int maxConcurrentJobs) {
    return new CoordinatorSettings(
        batchSize, maxConcurrentJobs, jobTimeout, workerTimeout, sweepInterval, completedHistory);
  }

  public CoordinatorSettings withJobTimeout(Duration jobTimeout) {
    return new CoordinatorSettings(
        batchSize, maxConcurrentJobs, jobTimeout, workerTimeout, sweepInterval, completedHistory);
  }

  public CoordinatorSettings withWorkerTimeout(Duration workerTimeout) {
    return new CoordinatorSettings(
        batchSize, maxConcurrentJobs, jobTimeout, workerTimeout, sweepInterval, completedHistory);
  }

  public CoordinatorSettings withSweepInterval(Duration sweepInterval) {
    return new CoordinatorSettings(
        batchSize, maxConcurrentJobs, jobTimeout, workerTimeout, sweepInterval, completedHistory);
  }

  private static void requirePositive(String key, long value) {
    if (value <= 0) {
      throw new ConfigException(key + " must be positive, got " + value);
    }
  }
}
