package com.proxypool.validation;

import com.proxypool.validation.spi.ProbeOutcome;
import com.proxypool.validation.spi.ResultSink;
import com.proxypool.validation.spi.TargetProbe;
import com.proxypool.validation.spi.TargetSource;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/** Small in-memory collaborators shared by the coordination tests. */
public final class Fixtures {
  private Fixtures() {}

  public record Outcome(String target, boolean working) implements ProbeOutcome {
    @Override
    public boolean isWorking() {
      return working;
    }
  }

  public static List<String> targets(int count) {
    return IntStream.range(0, count).mapToObj(i -> "t" + i).collect(Collectors.toList());
  }

  public static List<Outcome> outcomes(List<String> targets, boolean working) {
    return targets.stream().map(t -> new Outcome(t, working)).collect(Collectors.toList());
  }

  /** Clock that only moves when told to. */
  public static final class MutableClock extends Clock {
    private volatile Instant now;

    public MutableClock(Instant start) {
      this.now = start;
    }

    public void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  public static final class ListSource implements TargetSource<String> {
    private final List<String> targets;
    public final List<Map<String, String>> filters =
        Collections.synchronizedList(new ArrayList<>());

    public ListSource(List<String> targets) {
      this.targets = targets;
    }

    @Override
    public List<String> fetch(Map<String, String> filter, int limit) {
      filters.add(filter);
      return limit > 0 && limit < targets.size() ? targets.subList(0, limit) : targets;
    }
  }

  public static final class ListSink implements ResultSink<Outcome> {
    public final List<List<Outcome>> batches = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void persist(List<Outcome> results) {
      batches.add(List.copyOf(results));
    }

    public List<Outcome> all() {
      synchronized (batches) {
        return batches.stream().flatMap(List::stream).collect(Collectors.toList());
      }
    }
  }

  /** Targets whose name ends with an even digit are working. */
  public static final class ParityProbe implements TargetProbe<String, Outcome> {
    @Override
    public Outcome probe(String target) {
      int last = target.charAt(target.length() - 1) - '0';
      return new Outcome(target, last % 2 == 0);
    }

    @Override
    public Outcome failure(String target, Throwable error) {
      return new Outcome(target, false);
    }
  }
}
