package ca.gc.cra.aoaisim.config;

import ca.gc.cra.aoaisim.validation.Numbers;
import ca.gc.cra.aoaisim.validation.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** Parsing helpers shared by the configuration records. */
final class ConfigValues {
  private ConfigValues() {
    // Utility
  }

  static int boundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      Numbers.requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  static long boundedLong(Map<String, String> kv, String key, long defaultValue, long min, long max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Numbers.requireRange(key, defaultValue, min, max);
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  static boolean bool(Map<String, String> kv, String key, boolean fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
    };
  }

  static String string(Map<String, String> kv, String key, String fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Strings.requireNonBlank(key, raw);
  }

  /**
   * Collects the distinct names appearing directly below {@code prefix}, e.g. {@code gpt-4} for
   * {@code openai.deployments.gpt-4.tokensPerMinute}.
   */
  static Set<String> childNames(Map<String, String> kv, String prefix) {
    Set<String> names = new TreeSet<>();
    for (String key : kv.keySet()) {
      if (key == null || !key.startsWith(prefix)) {
        continue;
      }
      String rest = key.substring(prefix.length());
      int idx = rest.lastIndexOf('.');
      if (idx <= 0) {
        throw new IllegalArgumentException("Expected " + prefix + "<name>.<property> but found " + key);
      }
      names.add(rest.substring(0, idx));
    }
    return names;
  }
}
