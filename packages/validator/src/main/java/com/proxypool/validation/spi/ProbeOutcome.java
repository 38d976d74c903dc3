package com.proxypool.validation.spi;

/** Minimal view the coordinator needs of a probe result: whether the target answered. */
public interface ProbeOutcome {
  boolean isWorking();
}
