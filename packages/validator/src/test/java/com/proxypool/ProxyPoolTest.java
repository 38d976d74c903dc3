package com.proxypool;

import static org.junit.jupiter.api.Assertions.*;

import com.proxypool.exception.StateException;
import com.proxypool.proxy.ProbeResult;
import com.proxypool.proxy.ProxyRecord;
import com.proxypool.validation.jobs.CoordinatorStats;
import com.proxypool.validation.transport.HttpCoordinatorClient;
import java.nio.file.Paths;
import org.junit.jupiter.api.*;

class ProxyPoolTest {
  private ProxyPool coordinatorPool;

  @AfterEach
  void tearDown() {
    if (coordinatorPool != null) coordinatorPool.shutdown();
  }

  private static String seedFile() throws Exception {
    return Paths.get(ProxyPoolTest.class.getResource("/proxies-seed.json").toURI()).toString();
  }

  private ProxyPool startCoordinator(String... extra) throws Exception {
    String[] base = {
      "--mode=coordinator",
      "--config-file=classpath:test-application.yaml",
      "--http.port=0",
      "--proxies.seed-file=" + seedFile()
    };
    String[] args = new String[base.length + extra.length];
    System.arraycopy(base, 0, args, 0, base.length);
    System.arraycopy(extra, 0, args, base.length, extra.length);
    ProxyPool pool = new ProxyPool(args);
    pool.initialize();
    return pool;
  }

  @Test
  void coordinatorModeServesControlPlane() throws Exception {
    coordinatorPool = startCoordinator("--status=active");

    assertFalse(coordinatorPool.isOneShot());
    assertTrue(coordinatorPool.httpServer().isRunning());
    assertTrue(coordinatorPool.coordinator().isStarted());
    assertEquals(4, coordinatorPool.repository().size());
    assertEquals(25, coordinatorPool.coordinator().settings().batchSize());

    HttpCoordinatorClient<ProxyRecord, ProbeResult> client =
        new HttpCoordinatorClient<>(
            "http://127.0.0.1:" + coordinatorPool.httpServer().getPort(),
            ProxyRecord.class,
            ProbeResult.class);
    try {
      assertEquals("healthy", client.health().path("status").asText());
      CoordinatorStats stats = client.stats();
      assertEquals(1, stats.jobsCreated());
      assertEquals(1, stats.queued());
    } finally {
      client.close();
    }
  }

  @Test
  void validateModeSubmitsToRemoteCoordinator() throws Exception {
    coordinatorPool = startCoordinator();
    ProxyPool validate =
        new ProxyPool(
            new String[] {
              "--mode=validate",
              "--config-file=classpath:test-application.yaml",
              "--coordinator-url=http://127.0.0.1:" + coordinatorPool.httpServer().getPort(),
              "--type=socks5",
              "--validate.deadline-seconds=0"
            });
    try {
      validate.initialize();

      assertTrue(validate.isOneShot());
      // no workers are attached, so the run stops at the deadline with the job still queued
      assertEquals(1, validate.lastStats().queued());
      assertEquals(1, coordinatorPool.coordinator().stats().jobsCreated());
    } finally {
      validate.shutdown();
    }
  }

  @Test
  void localModeWithNoMatchesFinishesImmediately() throws Exception {
    ProxyPool local =
        new ProxyPool(
            new String[] {
              "--mode=local",
              "--config-file=classpath:test-application.yaml",
              "--proxies.seed-file=" + seedFile(),
              "--country=ZZ",
              "--workers=2"
            });
    try {
      local.initialize();
      assertEquals(0, local.lastSummary().tested());
      assertEquals(2, local.lastSummary().workers());
    } finally {
      local.shutdown();
    }
  }

  @Test
  void rejectsUnknownMode() {
    ProxyPool pool =
        new ProxyPool(
            new String[] {"--mode=gateway", "--config-file=classpath:test-application.yaml"});
    assertThrows(IllegalArgumentException.class, pool::initialize);
  }

  @Test
  void configurationRequiresInitialization() {
    assertThrows(StateException.class, () -> new ProxyPool(new String[0]).configuration());
  }
}
