package com.proxypool.validation.transport;

import com.proxypool.exception.TransportException;
import com.proxypool.validation.jobs.Job;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The worker's view of the coordinator. Implemented once per transport so the worker loop is
 * identical in-process and over the network. "No job available" is an empty {@link Optional},
 * never an error.
 *
 * <p>Every method may throw {@link TransportException} when the coordinator cannot be reached.
 */
public interface CoordinatorClient<T, R> extends AutoCloseable {

  /** @return the id the coordinator registered the worker under */
  String registerWorker(String workerId, Map<String, String> info);

  void heartbeat(String workerId);

  Optional<Job<T, R>> leaseNextJob(String workerId);

  void completeJob(String jobId, List<R> results, String errorMessage);

  @Override
  default void close() {}
}
