package com.proxypool.validation.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxypool.utility.JacksonUtility;
import com.proxypool.validation.jobs.JobCoordinator;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /jobs/{job_id}: the job as queued, leased or recently finished. */
public final class JobStatusServlet extends HttpServlet {
  private final JobCoordinator<?, ?> coordinator;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public JobStatusServlet(JobCoordinator<?, ?> coordinator) {
    this.coordinator = coordinator;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String jobId = JsonResponses.pathParameter(req);
    if (jobId == null) {
      resp.sendError(400, "Missing jobId");
      return;
    }
    var job = coordinator.job(jobId);
    if (job.isEmpty()) {
      resp.sendError(404, "Unknown jobId");
      return;
    }
    JsonResponses.write(mapper, resp, 200, mapper.valueToTree(job.get()));
  }
}
