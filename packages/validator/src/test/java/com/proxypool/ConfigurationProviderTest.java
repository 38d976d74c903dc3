package com.proxypool;

import static org.junit.jupiter.api.Assertions.*;

import com.proxypool.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  void loadsClasspathYaml() {
    Configuration config =
        new ConfigurationProvider("classpath:test-application.yaml").config();

    assertEquals("127.0.0.1", config.getString("http.hostname"));
    assertEquals(9100, config.getInt("http.port"));
    assertEquals(25, config.getInt("coordinator.batch-size"));
    assertArrayEquals(
        new String[] {"http://echo.test/ip"}, config.getStringArray("probe.http-test-urls"));
    assertEquals(30, config.getInt("coordinator.sweep-interval-seconds", 30));
  }

  @Test
  void overridesWinOverYaml() {
    Configuration config =
        new ConfigurationProvider(
                "classpath:test-application.yaml",
                Map.of("http.port", "9200", "worker.concurrency", "4"))
            .config();

    assertEquals(9200, config.getInt("http.port"));
    assertEquals(4, config.getInt("worker.concurrency"));
    assertEquals(3, config.getInt("coordinator.max-concurrent-jobs"));
  }

  @Test
  void bundledDefaultsLoadWithoutLocation() {
    Configuration config = new ConfigurationProvider(null).config();
    assertEquals(50, config.getInt("coordinator.batch-size"));
  }

  @Test
  void readsFilesByPathAndUri(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("pool.yaml");
    Files.writeString(file, "worker:\n  concurrency: 7\n");

    Configuration byPath = new ConfigurationProvider(file.toString()).config();
    Configuration byUri = new ConfigurationProvider(file.toUri().toString()).config();

    assertEquals(7, byPath.getInt("worker.concurrency"));
    assertEquals(7, byUri.getInt("worker.concurrency"));
  }

  @Test
  void missingLocationFails(@TempDir Path dir) {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));
    assertThrows(ConfigException.class, () -> new ConfigurationProvider("classpath:absent.yaml"));
  }
}
