package com.proxypool.validation.worker;

import java.util.List;
import java.util.Objects;

/**
 * What a worker reports for one job: one result per probed target and, when the batch as a whole
 * failed, an error message. A failed batch may still carry the results gathered before the failure.
 */
public record JobOutcome<R>(List<R> results, String errorMessage) {

  public JobOutcome {
    results = results == null ? List.of() : results.stream().filter(Objects::nonNull).toList();
  }

  public static <R> JobOutcome<R> success(List<R> results) {
    return new JobOutcome<>(results, null);
  }

  public static <R> JobOutcome<R> failure(List<R> partial, String errorMessage) {
    return new JobOutcome<>(partial, errorMessage);
  }

  public boolean failed() {
    return errorMessage != null && !errorMessage.isBlank();
  }
}
