package com.proxypool.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

/** Logs control-plane traffic at DEBUG/TRACE and failed calls at WARN. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("Sending {} {}", request.method(), request.url());
      log.trace("Request body:\n{}", bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    }

    if (log.isDebugEnabled()) {
      log.debug(
          "Received {} for {} in {} ms", response.code(), request.url(), elapsedMs(startTime));
      if (log.isTraceEnabled()) {
        try {
          ResponseBody peeked = response.peekBody(64 * 1024);
          String body = peeked.string();
          log.trace("Response body:\n{}", body.isEmpty() ? "[empty]" : body);
        } catch (IOException e) {
          log.trace("Could not read response body", e);
        }
      }
    }
    return response;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
