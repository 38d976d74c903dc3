package com.proxypool.validation.transport;

import com.proxypool.exception.ExceptionUtil;
import com.proxypool.exception.TransportException;
import com.proxypool.validation.jobs.CoordinatorStats;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Client side of a remote validation: asks the coordinator to create jobs, then polls {@code GET
 * /stats} until the queue and the active table are empty or the deadline passes.
 */
public final class ValidationSubmitter {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(ValidationSubmitter.class);

  private final HttpCoordinatorClient<?, ?> client;
  private final Duration pollInterval;
  private final Duration deadline;
  private final Clock clock;

  public ValidationSubmitter(
      HttpCoordinatorClient<?, ?> client, Duration pollInterval, Duration deadline) {
    this(client, pollInterval, deadline, Clock.systemUTC());
  }

  public ValidationSubmitter(
      HttpCoordinatorClient<?, ?> client, Duration pollInterval, Duration deadline, Clock clock) {
    this.client = client;
    this.pollInterval = pollInterval;
    this.deadline = deadline;
    this.clock = clock;
  }

  /**
   * Submit a validation and wait for it to drain.
   *
   * @return the last stats observed; not drained when the deadline passed first
   * @throws TransportException when the submission itself fails
   */
  public CoordinatorStats submitAndWait(Map<String, String> filter, int limit) {
    int created = client.submitValidation(filter, limit);
    log.info("Coordinator created {} validation jobs", created);
    CoordinatorStats last = client.stats();
    if (created == 0) {
      return last;
    }

    Instant giveUp = clock.instant().plus(deadline);
    while (!last.isDrained()) {
      if (!clock.instant().isBefore(giveUp)) {
        log.warn(
            "Validation still running after {}s: {} queued, {} active",
            deadline.toSeconds(),
            last.queued(),
            last.active());
        return last;
      }
      try {
        Thread.sleep(pollInterval.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return last;
      }
      try {
        last = client.stats();
        log.info(
            "Progress: {} queued, {} active, {} workers, {}/{} working",
            last.queued(),
            last.active(),
            last.workerCount(),
            last.workingTargets(),
            last.targetsValidated());
      } catch (TransportException e) {
        log.warn("Could not read coordinator stats: {}", ExceptionUtil.extractErrorMessage(e));
      }
    }
    log.info("Validation complete: {}/{} working", last.workingTargets(), last.targetsValidated());
    return last;
  }
}
