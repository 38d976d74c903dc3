package com.proxypool.validation.worker;

import static org.junit.jupiter.api.Assertions.*;

import com.proxypool.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class WorkerSettingsTest {

  @Test
  void backoffDoublesUntilTheCap() {
    WorkerSettings settings =
        WorkerSettings.defaults()
            .withPollInterval(Duration.ofSeconds(5))
            .withMaxBackoff(Duration.ofSeconds(30));

    assertEquals(Duration.ofSeconds(5), settings.backoff(1));
    assertEquals(Duration.ofSeconds(10), settings.backoff(2));
    assertEquals(Duration.ofSeconds(20), settings.backoff(3));
    assertEquals(Duration.ofSeconds(30), settings.backoff(4));
    assertEquals(Duration.ofSeconds(30), settings.backoff(80));
  }

  @Test
  void readsConfiguration() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("worker.poll-interval-millis", 250);
    config.addProperty("worker.concurrency", 8);
    WorkerSettings settings = WorkerSettings.fromConfiguration(config);

    assertEquals(Duration.ofMillis(250), settings.pollInterval());
    assertEquals(8, settings.concurrency());
    assertEquals(5, settings.maxConsecutiveFailures());
    assertEquals(Duration.ofSeconds(30), settings.heartbeatInterval());
  }

  @Test
  void rejectsNonPositiveConcurrency() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("worker.concurrency", 0);
    assertThrows(ConfigException.class, () -> WorkerSettings.fromConfiguration(config));
  }
}
