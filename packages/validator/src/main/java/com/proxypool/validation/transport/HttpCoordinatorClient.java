package com.proxypool.validation.transport;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.proxypool.exception.ConfigException;
import com.proxypool.exception.TransportException;
import com.proxypool.http.OkHttpFactory;
import com.proxypool.utility.JacksonUtility;
import com.proxypool.validation.jobs.CoordinatorStats;
import com.proxypool.validation.jobs.Job;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Networked binding: talks to the coordinator's HTTP control plane. A {@code 204} from {@code GET
 * /get_job/{worker_id}} means no job is available and maps to an empty result, exactly like the
 * in-process binding. I/O failures and unexpected statuses surface as {@link TransportException}.
 */
public final class HttpCoordinatorClient<T, R> implements CoordinatorClient<T, R> {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(HttpCoordinatorClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final HttpUrl baseUrl;
  private final OkHttpClient http;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private final JavaType jobType;

  public HttpCoordinatorClient(String baseUrl, Class<T> targetType, Class<R> resultType) {
    this(
        baseUrl,
        OkHttpFactory.create(Duration.ofSeconds(10), Duration.ofSeconds(30)),
        targetType,
        resultType);
  }

  public HttpCoordinatorClient(
      String baseUrl, OkHttpClient http, Class<T> targetType, Class<R> resultType) {
    HttpUrl parsed = baseUrl == null ? null : HttpUrl.parse(baseUrl.trim());
    if (parsed == null) {
      throw new ConfigException("Invalid coordinator URL: " + baseUrl);
    }
    this.baseUrl = parsed;
    this.http = http;
    this.jobType =
        mapper.getTypeFactory().constructParametricType(Job.class, targetType, resultType);
  }

  public HttpUrl baseUrl() {
    return baseUrl;
  }

  @Override
  public String registerWorker(String workerId, Map<String, String> info) {
    ObjectNode body = mapper.createObjectNode();
    body.put("worker_id", workerId);
    body.set("worker_info", mapper.valueToTree(info == null ? Map.of() : info));
    JsonNode response = send(post(url("register_worker"), body), 200);
    return response.path("worker_id").asText(workerId);
  }

  @Override
  public void heartbeat(String workerId) {
    send(post(url("heartbeat", workerId), null), 200);
  }

  @Override
  public Optional<Job<T, R>> leaseNextJob(String workerId) {
    Request request = new Request.Builder().url(url("get_job", workerId)).get().build();
    try (Response response = http.newCall(request).execute()) {
      if (response.code() == 204) {
        return Optional.empty();
      }
      String text = bodyText(response);
      if (response.code() != 200) {
        throw unexpected(request, response.code(), text);
      }
      if (text.isBlank()) {
        return Optional.empty();
      }
      JsonNode node = mapper.readTree(text);
      if (node == null || node.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(mapper.convertValue(node, jobType));
    } catch (IOException | IllegalArgumentException e) {
      throw new TransportException("Failed to request job for worker " + workerId, e);
    }
  }

  @Override
  public void completeJob(String jobId, List<R> results, String errorMessage) {
    ObjectNode body = mapper.createObjectNode();
    body.put("job_id", jobId);
    body.set("results", mapper.valueToTree(results == null ? List.of() : results));
    if (errorMessage != null) body.put("error_message", errorMessage);
    send(post(url("complete_job"), body), 200);
  }

  public JsonNode health() {
    return send(new Request.Builder().url(url("health")).get().build(), 200);
  }

  public CoordinatorStats stats() {
    Request request = new Request.Builder().url(url("stats")).get().build();
    return CoordinatorStats.fromJson(send(request, 200));
  }

  /** @return number of jobs the coordinator created */
  public int submitValidation(Map<String, String> filter, int limit) {
    ObjectNode body = mapper.createObjectNode();
    body.set("filter", mapper.valueToTree(filter == null ? Map.of() : filter));
    if (limit > 0) body.put("limit", limit);
    return send(post(url("submit_validation_job"), body), 200).path("jobs_created").asInt();
  }

  @Override
  public void close() {
    http.dispatcher().executorService().shutdown();
    http.connectionPool().evictAll();
  }

  private HttpUrl url(String... segments) {
    HttpUrl.Builder builder = baseUrl.newBuilder();
    for (String segment : segments) {
      builder.addPathSegment(segment);
    }
    return builder.build();
  }

  private Request post(HttpUrl url, JsonNode body) {
    byte[] bytes;
    try {
      bytes = body == null ? new byte[0] : mapper.writeValueAsBytes(body);
    } catch (IOException e) {
      throw new TransportException("Failed to encode request for " + url, e);
    }
    return new Request.Builder().url(url).post(RequestBody.create(bytes, JSON)).build();
  }

  private JsonNode send(Request request, int expectedStatus) {
    try (Response response = http.newCall(request).execute()) {
      String text = bodyText(response);
      if (response.code() != expectedStatus) {
        throw unexpected(request, response.code(), text);
      }
      return text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text);
    } catch (IOException e) {
      throw new TransportException(
          "Call to coordinator failed: %s %s".formatted(request.method(), request.url()), e);
    }
  }

  private static String bodyText(Response response) throws IOException {
    ResponseBody body = response.body();
    return body == null ? "" : body.string();
  }

  private static TransportException unexpected(Request request, int code, String body) {
    log.debug("Unexpected response body from {}: {}", request.url(), body);
    return new TransportException(
        "Coordinator answered HTTP %d to %s %s".formatted(code, request.method(), request.url()));
  }
}
