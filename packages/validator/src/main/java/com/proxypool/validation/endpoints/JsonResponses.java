package com.proxypool.validation.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.proxypool.exception.ErrorDetails;
import com.proxypool.exception.ExceptionUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** Shared JSON plumbing for the coordinator servlets. */
final class JsonResponses {
  private JsonResponses() {}

  static void write(ObjectMapper mapper, HttpServletResponse resp, int status, JsonNode body)
      throws IOException {
    resp.setStatus(status);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(mapper.writeValueAsString(body));
  }

  static void error(ObjectMapper mapper, HttpServletResponse resp, int status, Throwable error)
      throws IOException {
    ErrorDetails details = ExceptionUtil.toErrorDetails(error);
    ObjectNode node = mapper.createObjectNode();
    node.put("detail", details.message());
    node.set("error", mapper.valueToTree(details));
    write(mapper, resp, status, node);
  }

  /** Read the request body as a JSON object; a missing body reads as an empty object. */
  static ObjectNode readObject(ObjectMapper mapper, HttpServletRequest req) throws IOException {
    byte[] body = req.getInputStream().readAllBytes();
    if (body.length == 0) {
      return mapper.createObjectNode();
    }
    JsonNode node = mapper.readTree(body);
    if (node == null || node.isNull() || node.isMissingNode()) {
      return mapper.createObjectNode();
    }
    if (!node.isObject()) {
      throw new IllegalArgumentException("Request body must be a JSON object");
    }
    return (ObjectNode) node;
  }

  /** Path remainder after the servlet mapping, without the leading slash; null when absent. */
  static String pathParameter(HttpServletRequest req) {
    String path = req.getPathInfo();
    if (path == null || path.length() <= 1) {
      return null;
    }
    return path.substring(1);
  }
}
