package com.proxypool.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Levels can be tuned from configuration using keys of the form
 * {@code logging.level.<logger-name>: <LEVEL>}, with {@code logging.level.root} for the root
 * logger.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} keys to the running Logback context. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      String value = configuration.getString(key);
      if (value == null || value.isBlank()) continue;

      // hierarchical configurations escape dots inside a node name as ".."
      String loggerName =
          key.length() > LEVEL_PREFIX.length() + 1
              ? key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".")
              : Logger.ROOT_LOGGER_NAME;
      if ("root".equalsIgnoreCase(loggerName)) {
        loggerName = Logger.ROOT_LOGGER_NAME;
      }
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        getLogger(LoggingService.class).warn("Ignoring unknown log level '{}' for {}", value, key);
        continue;
      }
      context.getLogger(loggerName).setLevel(level);
    }
  }
}
