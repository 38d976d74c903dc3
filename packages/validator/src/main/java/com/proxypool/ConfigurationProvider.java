package com.proxypool;

import com.proxypool.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.MapConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;

/**
 * Loads the application configuration. Lookups go to command line overrides first, then JVM
 * system properties, then the YAML document. The YAML is read from the given location, which may
 * be a {@code classpath:} resource, a {@code file:} URI or a plain path; without a location the
 * bundled {@code application.yaml} is used.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.proxypool.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final CompositeConfiguration config;

  public ConfigurationProvider(String location) {
    this(location, Map.of());
  }

  public ConfigurationProvider(String location, Map<String, String> overrides) {
    String resolved = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in = open(resolved)) {
      new FileHandler(yaml).load(in);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to load configuration from " + resolved, e);
    }
    log.debug("Loaded configuration from {}", resolved);

    this.config = new CompositeConfiguration();
    if (overrides != null && !overrides.isEmpty()) {
      config.addConfiguration(new MapConfiguration(Map.copyOf(overrides)));
    }
    config.addConfiguration(new SystemConfiguration());
    config.addConfiguration(yaml);
  }

  public Configuration config() {
    return config;
  }

  private static InputStream open(String location) throws IOException {
    if (location.startsWith("classpath:")) {
      String resource = location.substring("classpath:".length());
      if (resource.startsWith("/")) resource = resource.substring(1);
      InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
      if (in == null) {
        throw new ConfigException("Configuration resource not found: " + resource);
      }
      return in;
    }
    Path path = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    return Files.newInputStream(path);
  }
}
