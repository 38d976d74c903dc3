package com.proxypool.validation.endpoints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.proxypool.utility.JacksonUtility;
import com.proxypool.validation.jobs.JobCoordinator;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST /register_worker with {@code {"worker_id": "...", "worker_info": {...}}}. A missing worker
 * id is generated by the coordinator and returned in the response.
 */
public final class RegisterWorkerServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(RegisterWorkerServlet.class);

  private final JobCoordinator<?, ?> coordinator;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public RegisterWorkerServlet(JobCoordinator<?, ?> coordinator) {
    this.coordinator = coordinator;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode body;
    try {
      body = JsonResponses.readObject(mapper, req);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      JsonResponses.error(mapper, resp, 400, e);
      return;
    }

    try {
      String workerId = body.path("worker_id").asText(null);
      String id = coordinator.registerWorker(workerId, info(body.path("worker_info")));
      ObjectNode node = mapper.createObjectNode();
      node.put("status", "registered");
      node.put("worker_id", id);
      JsonResponses.write(mapper, resp, 200, node);
    } catch (RuntimeException e) {
      log.error("Worker registration failed", e);
      JsonResponses.error(mapper, resp, 500, e);
    }
  }

  private static Map<String, String> info(JsonNode node) {
    Map<String, String> info = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = node.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode value = e.getValue();
      if (!value.isNull()) {
        info.put(e.getKey(), value.isValueNode() ? value.asText() : value.toString());
      }
    }
    return info;
  }
}
