package com.proxypool.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxypool.exception.ConfigException;
import com.proxypool.exception.ExceptionUtil;
import com.proxypool.http.OkHttpFactory;
import com.proxypool.utility.JacksonUtility;
import com.proxypool.validation.spi.TargetProbe;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.ProtocolException;
import java.net.Proxy;
import java.net.Socket;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import javax.net.ssl.SSLException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;

/**
 * Probes a proxy by fetching IP echo endpoints through it.
 *
 * <p>HTTP and HTTPS proxies are tried against each HTTP echo URL in turn until one answers 200 and
 * reports the proxy's address as the caller ({@code origin}, {@code ip} or {@code query}). A 200
 * whose body is not JSON counts as working. HTTPS support is then tested the same way against the
 * HTTPS echo URLs. SOCKS proxies are tested with a TCP connect to a well-known host through the
 * proxy, followed by the HTTPS test. Every failure is returned as data.
 */
public final class HttpProxyProbe implements TargetProbe<ProxyRecord, ProbeResult> {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(HttpProxyProbe.class);

  public static final List<String> DEFAULT_HTTP_TEST_URLS =
      List.of("http://httpbin.org/ip", "http://ip-api.com/json");
  public static final List<String> DEFAULT_HTTPS_TEST_URLS =
      List.of("https://api.ipify.org?format=json", "https://jsonip.com", "https://httpbin.org/ip");

  private static final String USER_AGENT =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)"
          + " Chrome/91.0.4472.124 Safari/537.36";

  private final Duration timeout;
  private final List<String> httpTestUrls;
  private final List<String> httpsTestUrls;
  private final InetSocketAddress socksCheckTarget;
  private final Clock clock;
  private final String workerId;
  private final OkHttpClient baseClient;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public HttpProxyProbe(
      Duration timeout,
      List<String> httpTestUrls,
      List<String> httpsTestUrls,
      InetSocketAddress socksCheckTarget,
      Clock clock,
      String workerId) {
    if (httpTestUrls.isEmpty()) {
      throw new ConfigException("At least one HTTP test URL is required");
    }
    this.timeout = timeout;
    this.httpTestUrls = List.copyOf(httpTestUrls);
    this.httpsTestUrls = List.copyOf(httpsTestUrls);
    this.socksCheckTarget = socksCheckTarget;
    this.clock = clock;
    this.workerId = workerId;
    this.baseClient = OkHttpFactory.createForProbes(timeout);
  }

  public static HttpProxyProbe fromConfiguration(Configuration config, String workerId) {
    try {
      Duration timeout = Duration.ofSeconds(config.getLong("probe.timeout-seconds", 10));
      if (timeout.isZero() || timeout.isNegative()) {
        throw new ConfigException("probe.timeout-seconds must be positive");
      }
      return new HttpProxyProbe(
          timeout,
          urls(config, "probe.http-test-urls", DEFAULT_HTTP_TEST_URLS),
          urls(config, "probe.https-test-urls", DEFAULT_HTTPS_TEST_URLS),
          InetSocketAddress.createUnresolved(
              config.getString("probe.socks-check-host", "8.8.8.8"),
              config.getInt("probe.socks-check-port", 53)),
          Clock.systemUTC(),
          workerId);
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid probe configuration", e);
    }
  }

  private static List<String> urls(Configuration config, String key, List<String> defaults) {
    String[] values = config.getStringArray(key);
    List<String> urls = Arrays.stream(values).map(String::trim).filter(s -> !s.isEmpty()).toList();
    return urls.isEmpty() ? defaults : urls;
  }

  @Override
  public ProbeResult probe(ProxyRecord proxy) {
    ProbeResult.Builder result =
        ProbeResult.builder(proxy).checkTime(clock.instant()).workerId(workerId);
    Optional<ProxyType> type = ProxyType.parse(proxy.type());
    if (type.isEmpty()) {
      return result
          .failed(ProbeErrorKind.UNSUPPORTED_SCHEME, "Unsupported proxy type: " + proxy.type())
          .build();
    }

    if (type.get().isSocks()) {
      result.checkMethod("socket");
      Proxy socks = new Proxy(Proxy.Type.SOCKS, new InetSocketAddress(proxy.ip(), proxy.port()));
      Attempt connect = connectThrough(socks);
      if (!connect.ok()) {
        return result.failed(connect.kind(), connect.message()).build();
      }
      result.working(connect.millis(), socksCheckTarget.toString());
      testHttps(socks, proxy, result);
      return result.build();
    }

    result.checkMethod("http");
    Proxy http = new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxy.ip(), proxy.port()));
    Attempt plain = fetchFirst(http, proxy, httpTestUrls);
    if (plain.ok()) {
      result.working(plain.millis(), plain.url());
    } else {
      result.failed(plain.kind(), "HTTP connection failed: " + plain.message());
    }
    testHttps(http, proxy, result);
    return result.build();
  }

  @Override
  public ProbeResult failure(ProxyRecord proxy, Throwable error) {
    return ProbeResult.builder(proxy)
        .checkTime(clock.instant())
        .workerId(workerId)
        .failed(ProbeErrorKind.INTERNAL, ExceptionUtil.extractErrorMessage(error))
        .build();
  }

  private void testHttps(Proxy route, ProxyRecord proxy, ProbeResult.Builder result) {
    if (httpsTestUrls.isEmpty()) return;
    Attempt secure = fetchFirst(route, proxy, httpsTestUrls);
    if (secure.ok()) {
      result.https(secure.millis());
    } else {
      result.httpsFailed("HTTPS connection failed: " + secure.message());
    }
  }

  private Attempt fetchFirst(Proxy route, ProxyRecord proxy, List<String> urls) {
    OkHttpClient client = baseClient.newBuilder().proxy(route).build();
    Attempt last = null;
    for (String url : urls) {
      last = fetch(client, proxy, url);
      if (last.ok()) return last;
      log.trace("{} via {} failed: {}", url, proxy.address(), last.message());
    }
    return last;
  }

  private Attempt fetch(OkHttpClient client, ProxyRecord proxy, String url) {
    Request request =
        new Request.Builder()
            .url(url)
            .header("User-Agent", USER_AGENT)
            .header("Accept", "application/json, text/plain, */*")
            .build();
    long start = System.nanoTime();
    try (Response response = client.newCall(request).execute()) {
      long millis = elapsedMillis(start);
      if (response.code() != 200) {
        return Attempt.failed(url, ProbeErrorKind.HTTP_STATUS, "HTTP " + response.code());
      }
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      JsonNode node;
      try {
        node = mapper.readTree(text);
      } catch (IOException notJson) {
        return Attempt.ok(url, millis);
      }
      if (node == null || !node.isObject()) {
        return Attempt.ok(url, millis);
      }
      String seen = echoedAddress(node);
      if (echoesAddress(seen, proxy.ip())) {
        return Attempt.ok(url, millis);
      }
      return Attempt.failed(
          url, ProbeErrorKind.IP_MISMATCH, "Echo endpoint saw " + seen + " instead of proxy");
    } catch (IOException e) {
      return Attempt.failed(url, classify(e), ExceptionUtil.extractErrorMessage(e));
    } catch (RuntimeException e) {
      return Attempt.failed(url, ProbeErrorKind.INTERNAL, ExceptionUtil.extractErrorMessage(e));
    }
  }

  private Attempt connectThrough(Proxy socks) {
    InetSocketAddress target =
        new InetSocketAddress(socksCheckTarget.getHostString(), socksCheckTarget.getPort());
    long start = System.nanoTime();
    try (Socket socket = new Socket(socks)) {
      socket.connect(target, (int) timeout.toMillis());
      return Attempt.ok(target.toString(), elapsedMillis(start));
    } catch (IOException e) {
      return Attempt.failed(
          target.toString(), classify(e), "SOCKS error: " + ExceptionUtil.extractErrorMessage(e));
    } catch (RuntimeException e) {
      return Attempt.failed(
          target.toString(), ProbeErrorKind.INTERNAL, ExceptionUtil.extractErrorMessage(e));
    }
  }

  private static String echoedAddress(JsonNode node) {
    for (String field : List.of("origin", "ip", "query")) {
      JsonNode value = node.get(field);
      if (value != null && value.isTextual() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return null;
  }

  /** {@code seen} may be a forwarding chain such as {@code "10.0.0.5, 203.0.113.9"}. */
  static boolean echoesAddress(String seen, String ip) {
    if (seen == null || ip == null) return false;
    return Arrays.stream(seen.split(",")).map(String::trim).anyMatch(ip.trim()::equals);
  }

  static ProbeErrorKind classify(IOException e) {
    if (e instanceof InterruptedIOException) {
      return ProbeErrorKind.TIMEOUT;
    }
    if (e instanceof ConnectException) {
      return mentionsRefused(e)
          ? ProbeErrorKind.CONNECTION_REFUSED
          : ProbeErrorKind.CONNECTION_ERROR;
    }
    if (e instanceof SSLException || e instanceof ProtocolException) {
      return ProbeErrorKind.PROTOCOL_MISMATCH;
    }
    return ProbeErrorKind.CONNECTION_ERROR;
  }

  private static boolean mentionsRefused(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t.getMessage() != null && t.getMessage().toLowerCase(Locale.ROOT).contains("refused")) {
        return true;
      }
      if (t.getCause() == t) break;
    }
    return false;
  }

  private static long elapsedMillis(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
  }

  private record Attempt(
      boolean ok, String url, long millis, ProbeErrorKind kind, String message) {
    static Attempt ok(String url, long millis) {
      return new Attempt(true, url, millis, null, null);
    }

    static Attempt failed(String url, ProbeErrorKind kind, String message) {
      return new Attempt(false, url, 0, kind, message);
    }
  }
}
