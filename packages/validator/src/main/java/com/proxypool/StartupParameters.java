package com.proxypool;

import com.proxypool.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line arguments in {@code --key=value} or {@code --key value} form. A bare {@code --flag}
 * reads as {@code true}. Arguments whose key contains a dot, such as {@code --http.port=9000},
 * double as configuration overrides.
 */
public class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null || arg.isBlank()) continue;
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unexpected argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq >= 0) {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(body, args[++i]);
      } else {
        parameters.put(body, "true");
      }
    }
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return getParameter(name, type, null);
  }

  public <T> T getParameter(String name, Class<T> type, T defaultValue) {
    String raw = parameters.get(name);
    if (raw == null) return defaultValue;
    try {
      if (type == String.class) return type.cast(raw);
      if (type == Integer.class) return type.cast(Integer.valueOf(raw.trim()));
      if (type == Long.class) return type.cast(Long.valueOf(raw.trim()));
      if (type == Boolean.class) return type.cast(Boolean.valueOf(raw.trim()));
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid value for --%s: %s".formatted(name, raw), e);
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  /** Location of the YAML configuration, from {@code --config-file} or {@code --config}. */
  public String configFile() {
    String location = parameters.get("config-file");
    return location != null ? location : parameters.get("config");
  }

  /** Arguments that name configuration keys. */
  public Map<String, String> configurationOverrides() {
    Map<String, String> overrides = new LinkedHashMap<>();
    parameters.forEach(
        (key, value) -> {
          if (key.contains(".")) overrides.put(key, value);
        });
    return overrides;
  }

  public Map<String, String> parameters() {
    return Collections.unmodifiableMap(parameters);
  }
}
