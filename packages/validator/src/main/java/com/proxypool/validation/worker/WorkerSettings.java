package com.proxypool.validation.worker;

import com.proxypool.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** Tunables of a validation worker, resolved from the {@code worker.*} configuration keys. */
public record WorkerSettings(
    Duration pollInterval,
    int concurrency,
    int maxConsecutiveFailures,
    Duration maxBackoff,
    Duration heartbeatInterval) {

  public WorkerSettings {
    if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
      throw new ConfigException("worker.poll-interval-millis must be positive");
    }
    if (concurrency <= 0) {
      throw new ConfigException("worker.concurrency must be positive, got " + concurrency);
    }
    if (maxConsecutiveFailures <= 0) {
      throw new ConfigException(
          "worker.max-consecutive-failures must be positive, got " + maxConsecutiveFailures);
    }
    if (maxBackoff == null || maxBackoff.compareTo(pollInterval) < 0) {
      throw new ConfigException("worker.max-backoff-millis must be at least the poll interval");
    }
    if (heartbeatInterval == null || heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
      throw new ConfigException("worker.heartbeat-interval-seconds must be positive");
    }
  }

  public static WorkerSettings defaults() {
    return new WorkerSettings(
        Duration.ofSeconds(5), 20, 5, Duration.ofSeconds(60), Duration.ofSeconds(30));
  }

  public static WorkerSettings fromConfiguration(Configuration config) {
    WorkerSettings d = defaults();
    try {
      return new WorkerSettings(
          Duration.ofMillis(
              config.getLong("worker.poll-interval-millis", d.pollInterval().toMillis())),
          config.getInt("worker.concurrency", d.concurrency()),
          config.getInt("worker.max-consecutive-failures", d.maxConsecutiveFailures()),
          Duration.ofMillis(config.getLong("worker.max-backoff-millis", d.maxBackoff().toMillis())),
          Duration.ofSeconds(
              config.getLong(
                  "worker.heartbeat-interval-seconds", d.heartbeatInterval().toSeconds())));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid worker configuration", e);
    }
  }

  public WorkerSettings withPollInterval(Duration pollInterval) {
    Duration backoff = maxBackoff.compareTo(pollInterval) < 0 ? pollInterval : maxBackoff;
    return new WorkerSettings(
        pollInterval, concurrency, maxConsecutiveFailures, backoff, heartbeatInterval);
  }

  public WorkerSettings withConcurrency(int concurrency) {
    return new WorkerSettings(
        pollInterval, concurrency, maxConsecutiveFailures, maxBackoff, heartbeatInterval);
  }

  public WorkerSettings withMaxConsecutiveFailures(int maxConsecutiveFailures) {
    return new WorkerSettings(
        pollInterval, concurrency, maxConsecutiveFailures, maxBackoff, heartbeatInterval);
  }

  public WorkerSettings withMaxBackoff(Duration maxBackoff) {
    return new WorkerSettings(
        pollInterval, concurrency, maxConsecutiveFailures, maxBackoff, heartbeatInterval);
  }

  public WorkerSettings withHeartbeatInterval(Duration heartbeatInterval) {
    return new WorkerSettings(
        pollInterval, concurrency, maxConsecutiveFailures, maxBackoff, heartbeatInterval);
  }

  /**
   * Delay after the {@code failures}-th consecutive failed lease request: the poll interval
   * doubled per failure, capped at {@link #maxBackoff()}.
   */
  public Duration backoff(int failures) {
    if (failures <= 1) return pollInterval;
    int shift = Math.min(failures - 1, 30);
    long millis = pollInterval.toMillis();
    long delay = millis > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : millis << shift;
    return delay >= maxBackoff.toMillis() ? maxBackoff : Duration.ofMillis(delay);
  }
}
