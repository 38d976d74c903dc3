package com.proxypool.proxy;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * A proxy as handed to workers: identity, address and the health fields the target source filters
 * on. {@code type} is kept as sent so the probe can report unsupported schemes.
 */
public record ProxyRecord(
    @JsonProperty("id") String id,
    @JsonProperty("ip") String ip,
    @JsonProperty("port") int port,
    @JsonProperty("type") String type,
    @JsonProperty("country") String country,
    @JsonProperty("status") ProxyStatus status,
    @JsonProperty("last_checked") Instant lastChecked) {

  public ProxyRecord {
    if (status == null) status = ProxyStatus.UNTESTED;
  }

  public static ProxyRecord of(String id, String ip, int port, String type) {
    return new ProxyRecord(id, ip, port, type, null, ProxyStatus.UNTESTED, null);
  }

  public String address() {
    return ip + ":" + port;
  }

  ProxyRecord withHealth(ProxyStatus status, Instant lastChecked) {
    return new ProxyRecord(id, ip, port, type, country, status, lastChecked);
  }
}
