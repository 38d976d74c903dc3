package com.proxypool.validation.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.proxypool.utility.JacksonUtility;
import com.proxypool.validation.jobs.JobCoordinator;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** POST /heartbeat/{worker_id} */
public final class HeartbeatServlet extends HttpServlet {
  private final JobCoordinator<?, ?> coordinator;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public HeartbeatServlet(JobCoordinator<?, ?> coordinator) {
    this.coordinator = coordinator;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String workerId = JsonResponses.pathParameter(req);
    if (workerId == null || workerId.isBlank()) {
      resp.sendError(400, "Missing worker id");
      return;
    }
    coordinator.heartbeat(workerId);
    ObjectNode node = mapper.createObjectNode();
    node.put("status", "acknowledged");
    JsonResponses.write(mapper, resp, 200, node);
  }
}
