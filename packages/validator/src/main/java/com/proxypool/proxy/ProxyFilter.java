package com.proxypool.proxy;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Selection criteria of the target source. Keys: {@code status}, {@code type}, {@code country},
 * {@code older_than_minutes} and {@code older_than_hours}. The age filters match proxies last
 * checked before the cutoff and proxies never checked at all. Unknown keys are ignored.
 */
public final class ProxyFilter implements Predicate<ProxyRecord> {
  private final String status;
  private final String type;
  private final String country;
  private final Instant checkedBefore;

  private ProxyFilter(String status, String type, String country, Instant checkedBefore) {
    this.status = status;
    this.type = type;
    this.country = country;
    this.checkedBefore = checkedBefore;
  }

  /**
   * @throws IllegalArgumentException when an age filter is not a number
   */
  public static ProxyFilter from(Map<String, String> filter, Instant now) {
    Map<String, String> f = filter == null ? Map.of() : filter;
    Instant cutoff = null;
    if (isSet(f.get("older_than_minutes"))) {
      cutoff = now.minus(Duration.ofMinutes(number(f, "older_than_minutes")));
    } else if (isSet(f.get("older_than_hours"))) {
      cutoff = now.minus(Duration.ofHours(number(f, "older_than_hours")));
    }
    return new ProxyFilter(
        normalized(f.get("status")),
        normalized(f.get("type")),
        normalized(f.get("country")),
        cutoff);
  }

  @Override
  public boolean test(ProxyRecord proxy) {
    if (status != null && !status.equals(proxy.status().wireName())) return false;
    if (type != null && !type.equals(normalized(proxy.type()))) return false;
    if (country != null && !country.equals(normalized(proxy.country()))) return false;
    if (checkedBefore != null
        && proxy.lastChecked() != null
        && !proxy.lastChecked().isBefore(checkedBefore)) {
      return false;
    }
    return true;
  }

  private static long number(Map<String, String> filter, String key) {
    try {
      return Long.parseLong(filter.get(key).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be a number: " + filter.get(key), e);
    }
  }

  private static boolean isSet(String value) {
    return value != null && !value.isBlank();
  }

  private static String normalized(String value) {
    return isSet(value) ? value.trim().toLowerCase(Locale.ROOT) : null;
  }
}
