package com.proxypool.validation.worker;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Outcome of a local validation run. */
public record ValidationSummary(
    @JsonProperty("tested") long tested,
    @JsonProperty("working") long working,
    @JsonProperty("jobs") int jobs,
    @JsonProperty("duration_ms") long durationMillis,
    @JsonProperty("workers") int workers) {

  public static ValidationSummary empty(int workers) {
    return new ValidationSummary(0, 0, 0, 0, workers);
  }

  /** Share of tested targets that were working, in percent. */
  @JsonProperty("success_rate")
  public double successRate() {
    return tested == 0 ? 0.0 : working * 100.0 / tested;
  }
}
