package com.proxypool.proxy;

import java.util.Locale;
import java.util.Optional;

/** Proxy protocols the probe knows how to test. */
public enum ProxyType {
  HTTP,
  HTTPS,
  SOCKS4,
  SOCKS5;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isSocks() {
    return this == SOCKS4 || this == SOCKS5;
  }

  /** Parse a wire name such as {@code socks5}; empty for anything unsupported. */
  public static Optional<ProxyType> parse(String value) {
    if (value == null) return Optional.empty();
    for (ProxyType type : values()) {
      if (type.wireName().equalsIgnoreCase(value.trim())) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
