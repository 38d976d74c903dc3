package com.proxypool.validation.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.proxypool.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;

/** GET /health */
public final class HealthServlet extends HttpServlet {
  private final Clock clock;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public HealthServlet(Clock clock) {
    this.clock = clock;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    ObjectNode node = mapper.createObjectNode();
    node.put("status", "healthy");
    node.put("timestamp", clock.instant().toString());
    JsonResponses.write(mapper, resp, 200, node);
  }
}
