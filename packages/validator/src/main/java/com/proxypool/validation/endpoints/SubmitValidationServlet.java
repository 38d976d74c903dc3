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
 * POST /submit_validation_job with {@code {"filter": {...}, "limit": 1000}}. The filter may also
 * be sent as {@code proxy_filter}; a missing or non-positive limit means no limit.
 */
public final class SubmitValidationServlet extends HttpServlet {
  private final JobCoordinator<?, ?> coordinator;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public SubmitValidationServlet(JobCoordinator<?, ?> coordinator) {
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

    JsonNode filterNode = body.has("filter") ? body.path("filter") : body.path("proxy_filter");
    Map<String, String> filter = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = filterNode.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      if (!e.getValue().isNull()) filter.put(e.getKey(), e.getValue().asText());
    }
    int limit = body.path("limit").asInt(0);

    int created = coordinator.submitValidation(filter, limit);
    ObjectNode node = mapper.createObjectNode();
    node.put("status", "submitted");
    node.put("jobs_created", created);
    node.put("message", "Created %d validation jobs".formatted(created));
    JsonResponses.write(mapper, resp, 200, node);
  }
}
