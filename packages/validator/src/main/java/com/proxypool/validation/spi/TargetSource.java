package com.proxypool.validation.spi;

import java.util.List;
import java.util.Map;

/**
 * Supplies probe targets to the coordinator. By convention implementations return targets
 * oldest-checked-first; the coordinator does not enforce any order beyond preserving the returned
 * one.
 *
 * @param <T> target record type
 */
@FunctionalInterface
public interface TargetSource<T> {

  /**
   * @param filter implementation-defined criteria, never null
   * @param limit maximum number of targets, or {@code <= 0} for no limit
   */
  List<T> fetch(Map<String, String> filter, int limit);
}
