package com.proxypool.validation.worker;

public enum WorkerState {
  CREATED,
  RUNNING,
  /** Left the loop after {@link ValidationWorker#stop()}. */
  STOPPED,
  /** Gave up after too many consecutive failed lease requests. */
  TERMINATED
}
