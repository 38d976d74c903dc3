package com.proxypool.validation.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.proxypool.validation.Fixtures;
import com.proxypool.validation.Fixtures.Outcome;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TargetBatcherTest {
  private final TargetBatcher batcher = new TargetBatcher(Clock.systemUTC(), 300);

  @Test
  @DisplayName("125 targets with batch size 50 make jobs of 50, 50 and 25")
  void splitsIntoContiguousBatches() {
    List<String> targets = Fixtures.targets(125);
    List<Job<String, Outcome>> jobs = batcher.batch(targets, 50);

    assertEquals(3, jobs.size());
    assertEquals(List.of(50, 50, 25), jobs.stream().map(j -> j.targets().size()).toList());

    List<String> joined = new ArrayList<>();
    jobs.forEach(j -> joined.addAll(j.targets()));
    assertEquals(targets, joined);
  }

  @Test
  void producesCeilingOfSizeOverBatch() {
    for (int n = 1; n <= 40; n++) {
      for (int b = 1; b <= 12; b++) {
        List<Job<String, Outcome>> jobs = batcher.batch(Fixtures.targets(n), b);
        assertEquals((n + b - 1) / b, jobs.size(), "n=" + n + " b=" + b);
      }
    }
  }

  @Test
  void newJobsArePendingWithDistinctIds() {
    List<Job<String, Outcome>> jobs = batcher.batch(Fixtures.targets(10), 3);
    assertTrue(jobs.stream().allMatch(j -> j.status() == JobStatus.PENDING));
    assertTrue(jobs.stream().allMatch(j -> j.owner() == null && j.results() == null));
    assertEquals(jobs.size(), jobs.stream().map(Job::id).distinct().count());
    assertEquals(300, jobs.get(0).timeoutSeconds());
  }

  @Test
  void emptyInputMakesNoJobs() {
    assertTrue(batcher.batch(List.of(), 5).isEmpty());
  }

  @Test
  void rejectsNonPositiveBatchSize() {
    assertThrows(IllegalArgumentException.class, () -> batcher.batch(Fixtures.targets(3), 0));
  }
}
