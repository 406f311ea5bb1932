package com.mk.fx.qa.latency.execution.utils;

import java.time.Duration;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  /** Parses "250ms", "10s", "5m", "1h" or ISO-8601 ("PT10S"); blank gives {@code fallback}. */
  public static Duration parseDuration(String value, Duration fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String trimmed = value.trim().toLowerCase();
    if (trimmed.startsWith("pt")) {
      return Duration.parse(trimmed.toUpperCase());
    }
    if (trimmed.endsWith("ms")) {
      long ms = Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim());
      return Duration.ofMillis(ms);
    }
    char unit = trimmed.charAt(trimmed.length() - 1);
    long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim());
    return switch (unit) {
      case 's' -> Duration.ofSeconds(amount);
      case 'm' -> Duration.ofMinutes(amount);
      case 'h' -> Duration.ofHours(amount);
      default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
    };
  }

  public static Duration millis(Integer value, int fallbackMs) {
    return Duration.ofMillis(value != null ? value : fallbackMs);
  }
}
