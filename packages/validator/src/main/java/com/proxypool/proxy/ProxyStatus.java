package com.proxypool.proxy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ProxyStatus {
  UNTESTED,
  ACTIVE,
  INACTIVE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ProxyStatus fromWire(String value) {
    if (value == null || value.isBlank()) return UNTESTED;
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
