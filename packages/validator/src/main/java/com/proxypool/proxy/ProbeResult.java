package com.proxypool.proxy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.proxypool.validation.spi.ProbeOutcome;
import java.time.Instant;
import java.util.Objects;

/** Outcome of probing one proxy: HTTP reachability, optional HTTPS support and timings. */
public final class ProbeResult implements ProbeOutcome {
  private final String proxyId;
  private final String ip;
  private final int port;
  private final String type;
  private final boolean working;
  private final Long responseTimeMs;
  private final String errorMessage;
  private final ProbeErrorKind errorKind;
  private final boolean supportsHttps;
  private final Long httpsResponseTimeMs;
  private final String httpsErrorMessage;
  private final Instant checkTime;
  private final String checkMethod;
  private final String targetUrl;
  private final String workerId;

  @JsonCreator
  public ProbeResult(
      @JsonProperty("proxy_id") String proxyId,
      @JsonProperty("ip") String ip,
      @JsonProperty("port") int port,
      @JsonProperty("type") String type,
      @JsonProperty("is_working") boolean working,
      @JsonProperty("response_time_ms") Long responseTimeMs,
      @JsonProperty("error_message") String errorMessage,
      @JsonProperty("error_kind") ProbeErrorKind errorKind,
      @JsonProperty("supports_https") boolean supportsHttps,
      @JsonProperty("https_response_time_ms") Long httpsResponseTimeMs,
      @JsonProperty("https_error_message") String httpsErrorMessage,
      @JsonProperty("check_time") Instant checkTime,
      @JsonProperty("check_method") String checkMethod,
      @JsonProperty("target_url") String targetUrl,
      @JsonProperty("worker_id") String workerId) {
    this.proxyId = proxyId;
    this.ip = ip;
    this.port = port;
    this.type = type;
    this.working = working;
    this.responseTimeMs = responseTimeMs;
    this.errorMessage = errorMessage;
    this.errorKind = errorKind;
    this.supportsHttps = supportsHttps;
    this.httpsResponseTimeMs = httpsResponseTimeMs;
    this.httpsErrorMessage = httpsErrorMessage;
    this.checkTime = checkTime;
    this.checkMethod = checkMethod;
    this.targetUrl = targetUrl;
    this.workerId = workerId;
  }

  public static Builder builder(ProxyRecord proxy) {
    return new Builder(proxy);
  }

  @JsonProperty("proxy_id")
  public String proxyId() {
    return proxyId;
  }

  @JsonProperty("ip")
  public String ip() {
    return ip;
  }

  @JsonProperty("port")
  public int port() {
    return port;
  }

  @JsonProperty("type")
  public String type() {
    return type;
  }

  @Override
  @JsonProperty("is_working")
  public boolean isWorking() {
    return working;
  }

  @JsonProperty("response_time_ms")
  public Long responseTimeMs() {
    return responseTimeMs;
  }

  @JsonProperty("error_message")
  public String errorMessage() {
    return errorMessage;
  }

  @JsonProperty("error_kind")
  public ProbeErrorKind errorKind() {
    return errorKind;
  }

  @JsonProperty("supports_https")
  public boolean supportsHttps() {
    return supportsHttps;
  }

  @JsonProperty("https_response_time_ms")
  public Long httpsResponseTimeMs() {
    return httpsResponseTimeMs;
  }

  @JsonProperty("https_error_message")
  public String httpsErrorMessage() {
    return httpsErrorMessage;
  }

  @JsonProperty("check_time")
  public Instant checkTime() {
    return checkTime;
  }

  @JsonProperty("check_method")
  public String checkMethod() {
    return checkMethod;
  }

  @JsonProperty("target_url")
  public String targetUrl() {
    return targetUrl;
  }

  @JsonProperty("worker_id")
  public String workerId() {
    return workerId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ProbeResult that)) return false;
    return port == that.port
        && working == that.working
        && supportsHttps == that.supportsHttps
        && Objects.equals(proxyId, that.proxyId)
        && Objects.equals(ip, that.ip)
        && Objects.equals(type, that.type)
        && Objects.equals(responseTimeMs, that.responseTimeMs)
        && Objects.equals(errorMessage, that.errorMessage)
        && errorKind == that.errorKind
        && Objects.equals(httpsResponseTimeMs, that.httpsResponseTimeMs)
        && Objects.equals(httpsErrorMessage, that.httpsErrorMessage)
        && Objects.equals(checkTime, that.checkTime)
        && Objects.equals(checkMethod, that.checkMethod)
        && Objects.equals(targetUrl, that.targetUrl)
        && Objects.equals(workerId, that.workerId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(proxyId, ip, port, type, working, checkTime);
  }

  @Override
  public String toString() {
    return "ProbeResult{"
        + ip
        + ":"
        + port
        + " "
        + type
        + (working ? " working " + responseTimeMs + "ms" : " failed " + errorKind)
        + (supportsHttps ? ", https" : "")
        + "}";
  }

  public static final class Builder {
    private final ProxyRecord proxy;
    private boolean working;
    private Long responseTimeMs;
    private String errorMessage;
    private ProbeErrorKind errorKind;
    private boolean supportsHttps;
    private Long httpsResponseTimeMs;
    private String httpsErrorMessage;
    private Instant checkTime;
    private String checkMethod;
    private String targetUrl;
    private String workerId;

    private Builder(ProxyRecord proxy) {
      this.proxy = Objects.requireNonNull(proxy, "proxy");
    }

    public Builder working(long responseTimeMs, String targetUrl) {
      this.working = true;
      this.responseTimeMs = responseTimeMs;
      this.targetUrl = targetUrl;
      this.errorMessage = null;
      this.errorKind = null;
      return this;
    }

    public Builder failed(ProbeErrorKind kind, String message) {
      this.working = false;
      this.errorKind = kind;
      this.errorMessage = message;
      return this;
    }

    public Builder https(long responseTimeMs) {
      this.supportsHttps = true;
      this.httpsResponseTimeMs = responseTimeMs;
      this.httpsErrorMessage = null;
      return this;
    }

    public Builder httpsFailed(String message) {
      this.supportsHttps = false;
      this.httpsErrorMessage = message;
      return this;
    }

    public Builder checkTime(Instant checkTime) {
      this.checkTime = checkTime;
      return this;
    }

    public Builder checkMethod(String checkMethod) {
      this.checkMethod = checkMethod;
      return this;
    }

    public Builder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    public ProbeResult build() {
      return new ProbeResult(
          proxy.id(),
          proxy.ip(),
          proxy.port(),
          proxy.type(),
          working,
          responseTimeMs,
          errorMessage,
          errorKind,
          supportsHttps,
          httpsResponseTimeMs,
          httpsErrorMessage,
          checkTime,
          checkMethod,
          targetUrl,
          workerId);
    }
  }
}
