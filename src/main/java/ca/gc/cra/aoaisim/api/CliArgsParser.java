package ca.gc.cra.aoaisim.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} tokens into configuration overrides. Keys use the dotted names of the YAML file,
 * for example {@code server.port=9000} or {@code openai.deployments.gpt-4o.tokensPerMinute=10000}.
 *
 * @since 0.1.0
 */
final class CliArgsParser {
  private static final Pattern KEY = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {
    // Utility
  }

  /**
   * Parses overrides; later tokens replace earlier ones with the same key.
   *
   * @param tokens non-flag arguments
   * @return mutable map in argument order
   * @throws IllegalArgumentException when a token is not {@code key=value} or contains control characters
   */
  static Map<String, String> toMap(String[] tokens) {
    Map<String, String> overrides = new LinkedHashMap<>();
    if (tokens == null) {
      return overrides;
    }
    for (String token : tokens) {
      int idx = token.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + token + "')");
      }
      String key = token.substring(0, idx).trim();
      String value = token.substring(idx + 1).trim();
      if (!KEY.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (value.chars().anyMatch(Character::isISOControl)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      overrides.put(key, value);
    }
    return overrides;
  }
}
