package com.proxypool.validation.spi;

import java.util.List;

/**
 * Receives the results of completed jobs. May be called concurrently for different jobs and may
 * see the same target more than once when a timed-out job was retried.
 */
@FunctionalInterface
public interface ResultSink<R> {
  void persist(List<R> results);
}
