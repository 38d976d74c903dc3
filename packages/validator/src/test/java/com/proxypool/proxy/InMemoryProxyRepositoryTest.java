package com.proxypool.proxy;

import static org.junit.jupiter.api.Assertions.*;

import com.proxypool.exception.ConfigException;
import com.proxypool.validation.Fixtures.MutableClock;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryProxyRepositoryTest {
  private static final Instant NOON = Instant.parse("2024-01-01T12:00:00Z");

  private MutableClock clock;
  private InMemoryProxyRepository repository;

  @BeforeEach
  void setUp() throws Exception {
    clock = new MutableClock(NOON);
    Path seed = Paths.get(getClass().getResource("/proxies-seed.json").toURI());
    repository = InMemoryProxyRepository.fromSeedFile(seed, clock, 10);
  }

  private static List<String> ids(List<ProxyRecord> records) {
    return records.stream().map(ProxyRecord::id).toList();
  }

  private ProxyRecord proxy(String id) {
    return repository.health(id).orElseThrow().proxy();
  }

  @Test
  void loadsSeedFile() {
    assertEquals(4, repository.size());
    ProxyRecord p1 = proxy("p-1");
    assertEquals("10.0.0.1:8080", p1.address());
    assertEquals(ProxyStatus.ACTIVE, p1.status());
    assertEquals(Instant.parse("2024-01-01T10:00:00Z"), p1.lastChecked());
    assertEquals(ProxyStatus.UNTESTED, proxy("p-4").status());
  }

  @Test
  void missingSeedFileIsAConfigurationError() {
    assertThrows(
        ConfigException.class,
        () -> InMemoryProxyRepository.fromSeedFile(Path.of("does-not-exist.json"), clock, 10));
  }

  @Test
  void fetchReturnsNeverCheckedThenOldestFirst() {
    assertEquals(List.of("p-3", "p-4", "p-2", "p-1"), ids(repository.fetch(Map.of(), 0)));
    assertEquals(List.of("p-3", "p-4"), ids(repository.fetch(Map.of(), 2)));
  }

  @Test
  void fetchAppliesFilters() {
    assertEquals(List.of("p-1"), ids(repository.fetch(Map.of("status", "active"), 0)));
    assertEquals(List.of("p-3"), ids(repository.fetch(Map.of("type", "SOCKS5"), 0)));
    assertEquals(List.of("p-3", "p-1"), ids(repository.fetch(Map.of("country", "us"), 0)));
    assertEquals(
        List.of("p-3", "p-4", "p-2"),
        ids(repository.fetch(Map.of("older_than_hours", "3"), 0)));
  }

  @Test
  void workingResultMarksProxyActive() {
    ProxyRecord p2 = proxy("p-2");
    clock.advance(Duration.ofMinutes(5));

    repository.persist(
        List.of(
            ProbeResult.builder(p2)
                .working(120, "http://httpbin.org/ip")
                .https(300)
                .checkMethod("http")
                .build()));

    ProxyHealth health = repository.health("p-2").orElseThrow();
    assertEquals(ProxyStatus.ACTIVE, health.proxy().status());
    assertEquals(NOON.plus(Duration.ofMinutes(5)), health.proxy().lastChecked());
    assertEquals(NOON.plus(Duration.ofMinutes(5)), health.lastWorking());
    assertTrue(health.working());
    assertTrue(health.supportsHttps());
    assertEquals(120L, health.responseTimeMs());
    assertEquals(300L, health.httpsResponseTimeMs());
    assertEquals(1, health.successCount());
    assertEquals(1, health.totalChecks());
  }

  @Test
  void failuresCountUntilTheNextSuccess() {
    ProxyRecord p1 = proxy("p-1");
    repository.persist(List.of(ProbeResult.builder(p1).working(50, "u").build()));
    clock.advance(Duration.ofMinutes(1));
    repository.persist(
        List.of(ProbeResult.builder(p1).failed(ProbeErrorKind.TIMEOUT, "timed out").build()));
    repository.persist(
        List.of(ProbeResult.builder(p1).failed(ProbeErrorKind.TIMEOUT, "timed out").build()));

    ProxyHealth failing = repository.health("p-1").orElseThrow();
    assertEquals(ProxyStatus.INACTIVE, failing.proxy().status());
    assertEquals(2, failing.failureCount());
    assertEquals(1, failing.successCount());
    assertEquals(NOON, failing.lastWorking());

    repository.persist(List.of(ProbeResult.builder(p1).working(40, "u").build()));

    ProxyHealth recovered = repository.health("p-1").orElseThrow();
    assertEquals(0, recovered.failureCount());
    assertEquals(2, recovered.successCount());
    assertEquals(4, recovered.totalChecks());
  }

  @Test
  void unknownProxiesAreSkipped() {
    ProxyRecord stranger = ProxyRecord.of("p-99", "10.9.9.9", 80, "http");

    repository.persist(
        List.of(
            ProbeResult.builder(stranger).working(10, "u").build(),
            ProbeResult.builder(proxy("p-4")).working(10, "u").build()));

    assertEquals(4, repository.size());
    assertTrue(repository.health("p-99").isEmpty());
    assertEquals(ProxyStatus.ACTIVE, proxy("p-4").status());
    assertEquals(1, repository.history(null).size());
  }

  @Test
  void historyIsBoundedAndNewestFirst() {
    InMemoryProxyRepository small = new InMemoryProxyRepository(clock, 2);
    ProxyRecord proxy = small.add(ProxyRecord.of(null, "10.1.1.1", 3128, "http"));
    assertNotNull(proxy.id());

    for (int i = 1; i <= 3; i++) {
      clock.advance(Duration.ofMinutes(1));
      small.persist(
          List.of(
              ProbeResult.builder(proxy)
                  .failed(ProbeErrorKind.CONNECTION_REFUSED, "attempt " + i)
                  .build()));
    }

    List<CheckHistoryEntry> history = small.history(proxy.id());
    assertEquals(2, history.size());
    assertEquals("attempt 3", history.get(0).errorMessage());
    assertEquals("attempt 2", history.get(1).errorMessage());
    assertTrue(small.history("other").isEmpty());
  }
}
