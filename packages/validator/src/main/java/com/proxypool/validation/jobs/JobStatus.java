package com.proxypool.validation.jobs;

/** Lifecycle state of a validation job. */
public enum JobStatus {
  /** Created and waiting in the queue. */
  PENDING,
  /** Leased to exactly one worker. */
  IN_PROGRESS,
  /** Completed without a batch-level error. */
  COMPLETED,
  /** Completed with a batch-level error, or retired after its lease expired. */
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
