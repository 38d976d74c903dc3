package com.proxypool.validation.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxypool.utility.JacksonUtility;
import com.proxypool.validation.jobs.JobCoordinator;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /stats: queue depth, active leases, live workers and lifetime counters. */
public final class StatsServlet extends HttpServlet {
  private final JobCoordinator<?, ?> coordinator;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public StatsServlet(JobCoordinator<?, ?> coordinator) {
    this.coordinator = coordinator;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    JsonResponses.write(mapper, resp, 200, coordinator.stats().toJson(mapper));
  }
}
