package com.proxypool.validation.jobs;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Partitions a target list into contiguous, order-preserving batches and wraps each batch in a
 * {@link JobStatus#PENDING} {@link Job}. {@code n} targets with batch size {@code b} produce
 * {@code ceil(n / b)} jobs; only the last one may be short.
 */
public final class TargetBatcher {
  private final Clock clock;
  private final int timeoutSeconds;

  public TargetBatcher(Clock clock, int timeoutSeconds) {
    if (timeoutSeconds <= 0) {
      throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
    }
    this.clock = clock;
    this.timeoutSeconds = timeoutSeconds;
  }

  public <T, R> List<Job<T, R>> batch(List<T> targets, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
    }
    if (targets == null || targets.isEmpty()) {
      return List.of();
    }
    List<Job<T, R>> jobs = new ArrayList<>((targets.size() + batchSize - 1) / batchSize);
    for (int from = 0; from < targets.size(); from += batchSize) {
      int to = Math.min(from + batchSize, targets.size());
      jobs.add(new Job<>(targets.subList(from, to), timeoutSeconds, clock.instant()));
    }
    return jobs;
  }
}
