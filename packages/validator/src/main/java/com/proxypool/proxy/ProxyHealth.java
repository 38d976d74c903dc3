package com.proxypool.proxy;

import java.time.Instant;

/**
 * Health of one proxy as accumulated from probe results. {@code failureCount} counts failures since
 * the last success.
 */
public record ProxyHealth(
    ProxyRecord proxy,
    boolean working,
    Long responseTimeMs,
    boolean supportsHttps,
    Long httpsResponseTimeMs,
    Instant lastWorking,
    long successCount,
    long failureCount,
    long totalChecks) {

  static ProxyHealth untested(ProxyRecord proxy) {
    return new ProxyHealth(proxy, false, null, false, null, null, 0, 0, 0);
  }

  ProxyHealth apply(ProbeResult result, Instant now) {
    boolean ok = result.isWorking();
    ProxyRecord updated = proxy.withHealth(ok ? ProxyStatus.ACTIVE : ProxyStatus.INACTIVE, now);
    return new ProxyHealth(
        updated,
        ok,
        result.responseTimeMs(),
        result.supportsHttps(),
        result.supportsHttps() ? result.httpsResponseTimeMs() : httpsResponseTimeMs,
        ok ? now : lastWorking,
        ok ? successCount + 1 : successCount,
        ok ? 0 : failureCount + 1,
        totalChecks + 1);
  }
}
