package com.proxypool.validation.spi;

/**
 * Probes a single target. Implementations apply their own timeouts and report failures as data:
 * an unreachable target yields a result whose {@link ProbeOutcome#isWorking()} is false.
 *
 * @param <T> target record type
 * @param <R> result type
 */
public interface TargetProbe<T, R extends ProbeOutcome> {

  R probe(T target);

  /** Map an unexpected exception thrown by {@link #probe(Object)} to a failed result. */
  R failure(T target, Throwable error);
}
