package com.proxypool.validation.transport;

import com.proxypool.validation.jobs.Job;
import com.proxypool.validation.jobs.JobCoordinator;
import com.proxypool.validation.spi.ProbeOutcome;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Direct calls into a coordinator living in the same JVM. */
public final class InProcessCoordinatorClient<T, R extends ProbeOutcome>
    implements CoordinatorClient<T, R> {
  private final JobCoordinator<T, R> coordinator;

  public InProcessCoordinatorClient(JobCoordinator<T, R> coordinator) {
    this.coordinator = coordinator;
  }

  @Override
  public String registerWorker(String workerId, Map<String, String> info) {
    return coordinator.registerWorker(workerId, info);
  }

  @Override
  public void heartbeat(String workerId) {
    coordinator.heartbeat(workerId);
  }

  @Override
  public Optional<Job<T, R>> leaseNextJob(String workerId) {
    return coordinator.leaseNextJob(workerId);
  }

  @Override
  public void completeJob(String jobId, List<R> results, String errorMessage) {
    coordinator.completeJob(jobId, results, errorMessage);
  }
}
