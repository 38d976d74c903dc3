package com.proxypool.proxy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proxypool.exception.ConfigException;
import com.proxypool.utility.JacksonUtility;
import com.proxypool.validation.spi.ResultSink;
import com.proxypool.validation.spi.TargetSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Proxy health store kept in memory. It is the target source (proxies matching a filter, oldest
 * check first, never-checked first of all) and the result sink (status, counters, timings and a
 * bounded check history). Safe for concurrent use; results naming a proxy it does not know are
 * skipped, and a result applied twice simply counts as two checks.
 */
public final class InMemoryProxyRepository
    implements TargetSource<ProxyRecord>, ResultSink<ProbeResult> {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(InMemoryProxyRepository.class);

  private static final Comparator<ProxyRecord> OLDEST_CHECK_FIRST =
      Comparator.comparing(
          ProxyRecord::lastChecked, Comparator.nullsFirst(Comparator.naturalOrder()));

  private final Object lock = new Object();
  private final Clock clock;
  private final int historyLimit;
  private final Map<String, ProxyHealth> proxies = new LinkedHashMap<>();
  private final Deque<CheckHistoryEntry> history = new ArrayDeque<>();

  public InMemoryProxyRepository(Clock clock, int historyLimit) {
    this.clock = clock;
    this.historyLimit = Math.max(0, historyLimit);
  }

  /** Load a JSON array of proxy records, as written by {@link ProxyRecord}'s wire form. */
  public static InMemoryProxyRepository fromSeedFile(Path file, Clock clock, int historyLimit) {
    InMemoryProxyRepository repository = new InMemoryProxyRepository(clock, historyLimit);
    try (InputStream in = Files.newInputStream(file)) {
      repository.addAll(read(in));
    } catch (IOException e) {
      throw new ConfigException("Failed to read proxy seed file " + file, e);
    }
    log.info("Loaded {} proxies from {}", repository.size(), file);
    return repository;
  }

  static List<ProxyRecord> read(InputStream in) throws IOException {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    List<ProxyRecord> records = mapper.readValue(in, new TypeReference<List<ProxyRecord>>() {});
    return records == null ? List.of() : records;
  }

  /** Add or replace a proxy. A missing id is generated. */
  public ProxyRecord add(ProxyRecord proxy) {
    ProxyRecord stored =
        proxy.id() == null || proxy.id().isBlank()
            ? new ProxyRecord(
                UUID.randomUUID().toString(),
                proxy.ip(),
                proxy.port(),
                proxy.type(),
                proxy.country(),
                proxy.status(),
                proxy.lastChecked())
            : proxy;
    synchronized (lock) {
      proxies.put(stored.id(), ProxyHealth.untested(stored));
    }
    return stored;
  }

  public void addAll(List<ProxyRecord> records) {
    records.forEach(this::add);
  }

  public int size() {
    synchronized (lock) {
      return proxies.size();
    }
  }

  public Optional<ProxyHealth> health(String proxyId) {
    synchronized (lock) {
      return Optional.ofNullable(proxies.get(proxyId));
    }
  }

  /** Most recent checks first. */
  public List<CheckHistoryEntry> history(String proxyId) {
    synchronized (lock) {
      List<CheckHistoryEntry> entries = new ArrayList<>();
      history.descendingIterator()
          .forEachRemaining(
              e -> {
                if (proxyId == null || proxyId.equals(e.proxyId())) entries.add(e);
              });
      return entries;
    }
  }

  @Override
  public List<ProxyRecord> fetch(Map<String, String> filter, int limit) {
    ProxyFilter predicate = ProxyFilter.from(filter, clock.instant());
    List<ProxyRecord> matches;
    synchronized (lock) {
      matches =
          proxies.values().stream()
              .map(ProxyHealth::proxy)
              .filter(predicate)
              .sorted(OLDEST_CHECK_FIRST)
              .toList();
    }
    return limit > 0 && matches.size() > limit ? matches.subList(0, limit) : matches;
  }

  @Override
  public void persist(List<ProbeResult> results) {
    Instant now = clock.instant();
    int updated = 0;
    synchronized (lock) {
      for (ProbeResult result : results) {
        ProxyHealth current = result.proxyId() == null ? null : proxies.get(result.proxyId());
        if (current == null) {
          log.warn("Skipping result for unknown proxy {} ({})", result.proxyId(), result.ip());
          continue;
        }
        proxies.put(result.proxyId(), current.apply(result, now));
        record(result, now);
        updated++;
      }
    }
    log.debug("Updated {} of {} proxies", updated, results.size());
  }

  private void record(ProbeResult result, Instant now) {
    if (historyLimit == 0) return;
    history.addLast(
        new CheckHistoryEntry(
            result.proxyId(),
            result.isWorking(),
            result.responseTimeMs(),
            result.errorMessage(),
            result.checkMethod(),
            result.checkTime() != null ? result.checkTime() : now));
    while (history.size() > historyLimit) {
      history.pollFirst();
    }
  }
}
