package com.proxypool.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /** Client for control-plane calls between workers and the coordinator. */
  public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .writeTimeout(readTimeout)
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  /**
   * Client used as the base for proxy probes. Callers derive a per-proxy client through {@code
   * newBuilder().proxy(...)}, which shares the connection pool and dispatcher of this instance.
   */
  public static OkHttpClient createForProbes(Duration timeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(timeout)
        .readTimeout(timeout)
        .callTimeout(timeout.multipliedBy(2))
        .followRedirects(false)
        .retryOnConnectionFailure(false)
        .build();
  }
}
