package com.proxypool.validation.endpoints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.proxypool.utility.JacksonUtility;
import com.proxypool.validation.jobs.JobCoordinator;
import com.proxypool.validation.spi.ProbeOutcome;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/**
 * POST /complete_job with {@code {"job_id": "...", "results": [...], "error_message": null}}.
 * Completing an unknown or already finished job is acknowledged like any other completion.
 */
public final class CompleteJobServlet<R extends ProbeOutcome> extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(CompleteJobServlet.class);

  private final JobCoordinator<?, R> coordinator;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private final JavaType resultsType;

  public CompleteJobServlet(JobCoordinator<?, R> coordinator, Class<R> resultType) {
    this.coordinator = coordinator;
    this.resultsType = mapper.getTypeFactory().constructCollectionType(List.class, resultType);
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String jobId;
    List<R> results;
    String errorMessage;
    try {
      ObjectNode body = JsonResponses.readObject(mapper, req);
      jobId = body.path("job_id").asText(null);
      if (jobId == null || jobId.isBlank()) {
        throw new IllegalArgumentException("job_id is required");
      }
      JsonNode resultsNode = body.path("results");
      results =
          resultsNode.isArray() ? mapper.convertValue(resultsNode, resultsType) : List.of();
      JsonNode error = body.path("error_message");
      errorMessage = error.isTextual() ? error.asText() : null;
    } catch (JsonProcessingException | IllegalArgumentException e) {
      JsonResponses.error(mapper, resp, 400, e);
      return;
    }

    try {
      coordinator.completeJob(jobId, results, errorMessage);
      ObjectNode node = mapper.createObjectNode();
      node.put("status", "completed");
      JsonResponses.write(mapper, resp, 200, node);
    } catch (RuntimeException e) {
      log.error("Completion of job {} failed", jobId, e);
      JsonResponses.error(mapper, resp, 500, e);
    }
  }
}
