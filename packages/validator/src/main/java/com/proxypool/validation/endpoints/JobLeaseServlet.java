package com.proxypool.validation.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxypool.utility.JacksonUtility;
import com.proxypool.validation.jobs.Job;
import com.proxypool.validation.jobs.JobCoordinator;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;

/**
 * GET /get_job/{worker_id}. Answers 200 with the leased job, or 204 with no body when the queue is
 * empty or the coordinator is at its concurrency limit.
 */
public final class JobLeaseServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(JobLeaseServlet.class);

  private final JobCoordinator<?, ?> coordinator;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public JobLeaseServlet(JobCoordinator<?, ?> coordinator) {
    this.coordinator = coordinator;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String workerId = JsonResponses.pathParameter(req);
    if (workerId == null || workerId.isBlank()) {
      resp.sendError(400, "Missing worker id");
      return;
    }

    Optional<? extends Job<?, ?>> job;
    try {
      job = coordinator.leaseNextJob(workerId);
    } catch (RuntimeException e) {
      log.error("Lease request from {} failed", workerId, e);
      JsonResponses.error(mapper, resp, 500, e);
      return;
    }

    if (job.isEmpty()) {
      resp.setStatus(204);
      return;
    }
    JsonResponses.write(mapper, resp, 200, mapper.valueToTree(job.get()));
  }
}
