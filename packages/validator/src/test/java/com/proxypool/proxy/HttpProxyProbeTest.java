package com.proxypool.proxy;

import static org.junit.jupiter.api.Assertions.*;

import com.proxypool.http.EmbeddedJettyServer;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import javax.net.ssl.SSLHandshakeException;
import org.apache.commons.configuration2.BaseConfiguration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.junit.jupiter.api.*;

class HttpProxyProbeTest {
  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  /** Stands in for an HTTP proxy whose upstream is an IP echo service. */
  static final class EchoProxyServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String path = req.getRequestURI();
      if (path.endsWith("/down")) {
        resp.sendError(503);
        return;
      }
      if (path.endsWith("/text")) {
        resp.setContentType("text/plain");
        resp.getWriter().write("hello");
        return;
      }
      String origin = "127.0.0.1";
      if (path.endsWith("/elsewhere")) {
        origin = "198.51.100.7";
      } else if (path.endsWith("/lookalike")) {
        origin = "127.0.0.10";
      } else if (path.endsWith("/forwarded")) {
        origin = "10.9.8.7, 127.0.0.1";
      }
      resp.setContentType("application/json");
      resp.getWriter().write("{\"origin\":\"" + origin + "\"}");
    }
  }

  private EmbeddedJettyServer proxyServer;
  private ProxyRecord localProxy;

  @BeforeEach
  void setUp() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("http.hostname", "127.0.0.1");
    config.addProperty("http.port", 0);
    proxyServer = new EmbeddedJettyServer(config);
    proxyServer.prepare();
    proxyServer.getContextHandler().addServlet(new ServletHolder(new EchoProxyServlet()), "/*");
    proxyServer.start();
    localProxy = ProxyRecord.of("p-local", "127.0.0.1", proxyServer.getPort(), "http");
  }

  @AfterEach
  void tearDown() {
    proxyServer.close();
  }

  private static HttpProxyProbe probe(String... httpUrls) {
    return new HttpProxyProbe(
        Duration.ofSeconds(5),
        List.of(httpUrls),
        List.of(),
        InetSocketAddress.createUnresolved("127.0.0.1", 9),
        CLOCK,
        "w-test");
  }

  private static int closedPort() throws IOException {
    try (ServerSocket socket = new ServerSocket(0)) {
      return socket.getLocalPort();
    }
  }

  @Test
  void proxyEchoingItsOwnAddressIsWorking() {
    ProbeResult result = probe("http://echo.invalid/ip").probe(localProxy);

    assertTrue(result.isWorking(), result.errorMessage());
    assertEquals("http", result.checkMethod());
    assertEquals("http://echo.invalid/ip", result.targetUrl());
    assertNotNull(result.responseTimeMs());
    assertEquals(NOW, result.checkTime());
    assertEquals("w-test", result.workerId());
    assertEquals("p-local", result.proxyId());
    assertFalse(result.supportsHttps());
  }

  @Test
  void fallsThroughToTheNextUrl() {
    ProbeResult result =
        probe("http://echo.invalid/down", "http://echo.invalid/ip").probe(localProxy);

    assertTrue(result.isWorking());
    assertEquals("http://echo.invalid/ip", result.targetUrl());
  }

  @Test
  void nonJsonBodyCountsAsWorking() {
    assertTrue(probe("http://echo.invalid/text").probe(localProxy).isWorking());
  }

  @Test
  void differentEchoedAddressIsMismatch() {
    ProbeResult result = probe("http://echo.invalid/elsewhere").probe(localProxy);

    assertFalse(result.isWorking());
    assertEquals(ProbeErrorKind.IP_MISMATCH, result.errorKind());
    assertTrue(result.errorMessage().contains("198.51.100.7"), result.errorMessage());
  }

  @Test
  void addressSharingAPrefixIsMismatch() {
    ProbeResult result = probe("http://echo.invalid/lookalike").probe(localProxy);

    assertFalse(result.isWorking());
    assertEquals(ProbeErrorKind.IP_MISMATCH, result.errorKind());
  }

  @Test
  void proxyAddressInForwardingChainIsAccepted() {
    assertTrue(probe("http://echo.invalid/forwarded").probe(localProxy).isWorking());
  }

  @Test
  void echoedAddressesMatchExactly() {
    assertTrue(HttpProxyProbe.echoesAddress("1.2.3.4", "1.2.3.4"));
    assertTrue(HttpProxyProbe.echoesAddress("10.0.0.5,  1.2.3.4 ", "1.2.3.4"));
    assertFalse(HttpProxyProbe.echoesAddress("11.2.3.45", "1.2.3.4"));
    assertFalse(HttpProxyProbe.echoesAddress(null, "1.2.3.4"));
  }

  @Test
  void errorStatusIsReported() {
    ProbeResult result = probe("http://echo.invalid/down").probe(localProxy);

    assertFalse(result.isWorking());
    assertEquals(ProbeErrorKind.HTTP_STATUS, result.errorKind());
    assertTrue(result.errorMessage().contains("503"), result.errorMessage());
  }

  @Test
  void closedProxyPortIsRefused() throws Exception {
    ProxyRecord dead = ProxyRecord.of("p-dead", "127.0.0.1", closedPort(), "https");

    ProbeResult result = probe("http://echo.invalid/ip").probe(dead);

    assertFalse(result.isWorking());
    assertEquals(ProbeErrorKind.CONNECTION_REFUSED, result.errorKind());
    assertTrue(result.errorMessage().startsWith("HTTP connection failed"));
  }

  @Test
  void socksProxyUsesSocketCheck() throws Exception {
    ProxyRecord dead = ProxyRecord.of("p-socks", "127.0.0.1", closedPort(), "socks5");

    ProbeResult result = probe("http://echo.invalid/ip").probe(dead);

    assertFalse(result.isWorking());
    assertEquals("socket", result.checkMethod());
    assertTrue(result.errorMessage().startsWith("SOCKS error"), result.errorMessage());
  }

  @Test
  void unknownTypeIsUnsupported() {
    ProbeResult result =
        probe("http://echo.invalid/ip").probe(ProxyRecord.of("p-ftp", "10.0.0.1", 21, "ftp"));

    assertFalse(result.isWorking());
    assertEquals(ProbeErrorKind.UNSUPPORTED_SCHEME, result.errorKind());
    assertNull(result.checkMethod());
  }

  @Test
  void unexpectedErrorsMapToInternal() {
    ProbeResult result =
        probe("http://echo.invalid/ip").failure(localProxy, new IllegalStateException("bug"));

    assertFalse(result.isWorking());
    assertEquals(ProbeErrorKind.INTERNAL, result.errorKind());
    assertEquals("IllegalStateException: bug", result.errorMessage());
  }

  @Test
  void classifiesIoFailures() {
    assertEquals(ProbeErrorKind.TIMEOUT, HttpProxyProbe.classify(new SocketTimeoutException()));
    assertEquals(
        ProbeErrorKind.CONNECTION_REFUSED,
        HttpProxyProbe.classify(new ConnectException("Connection refused")));
    assertEquals(
        ProbeErrorKind.CONNECTION_ERROR,
        HttpProxyProbe.classify(new ConnectException("Network is unreachable")));
    assertEquals(
        ProbeErrorKind.PROTOCOL_MISMATCH,
        HttpProxyProbe.classify(new SSLHandshakeException("bad record")));
    assertEquals(
        ProbeErrorKind.CONNECTION_ERROR, HttpProxyProbe.classify(new IOException("reset")));
  }

  @Test
  void readsProbeConfiguration() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("probe.timeout-seconds", 0);
    assertThrows(
        com.proxypool.exception.ConfigException.class,
        () -> HttpProxyProbe.fromConfiguration(config, "w"));
  }
}
