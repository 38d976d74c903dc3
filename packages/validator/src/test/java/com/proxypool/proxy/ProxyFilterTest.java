package com.proxypool.proxy;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProxyFilterTest {
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private static ProxyRecord checkedAt(String instant) {
    return new ProxyRecord(
        "p", "10.0.0.1", 8080, "HTTP", "De", ProxyStatus.ACTIVE, Instant.parse(instant));
  }

  @Test
  void emptyFilterMatchesEverything() {
    assertTrue(ProxyFilter.from(null, NOW).test(checkedAt("2024-03-01T11:59:00Z")));
    assertTrue(
        ProxyFilter.from(Map.of("unknown", "x"), NOW).test(ProxyRecord.of("p", "h", 1, "x")));
  }

  @Test
  void comparesCaseInsensitively() {
    ProxyRecord proxy = checkedAt("2024-03-01T11:00:00Z");
    assertTrue(ProxyFilter.from(Map.of("type", "http", "country", "DE"), NOW).test(proxy));
    assertTrue(ProxyFilter.from(Map.of("status", "ACTIVE"), NOW).test(proxy));
    assertFalse(ProxyFilter.from(Map.of("status", "inactive"), NOW).test(proxy));
  }

  @Test
  void ageFilterKeepsStaleAndNeverChecked() {
    ProxyFilter stale = ProxyFilter.from(Map.of("older_than_minutes", "30"), NOW);

    assertTrue(stale.test(checkedAt("2024-03-01T11:00:00Z")));
    assertFalse(stale.test(checkedAt("2024-03-01T11:45:00Z")));
    assertTrue(stale.test(ProxyRecord.of("p", "10.0.0.1", 8080, "http")));
  }

  @Test
  void minutesTakePrecedenceOverHours() {
    ProxyFilter filter =
        ProxyFilter.from(Map.of("older_than_minutes", "10", "older_than_hours", "5"), NOW);
    assertTrue(filter.test(checkedAt("2024-03-01T11:30:00Z")));
  }

  @Test
  void nonNumericAgeIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ProxyFilter.from(Map.of("older_than_hours", "soon"), NOW));
  }
}
