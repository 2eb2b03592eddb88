package ca.gc.cra.aoaisim.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, environment and CLI sources while enforcing precedence and
 * cross-key invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; environment &gt; YAML &gt; defaults.
   *
   * @param yaml optional YAML-derived settings
   * @param env environment-derived settings (may be empty)
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> env,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (env != null) {
      merged.putAll(env);
    }

    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        if (entry.getValue() != null) {
          merged.put(key, entry.getValue());
        }
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String apiKey = trim(effective.get("apiKey"));
    if (apiKey.isEmpty()) {
      throw new IllegalArgumentException("apiKey is required (set apiKey=... or SIMULATOR_API_KEY)");
    }
    SimulatorMode mode = SimulatorMode.from(effective.get("mode"));
    if (mode == SimulatorMode.RECORD) {
      boolean hasForwarder = effective.keySet().stream()
          .anyMatch(k -> k.startsWith("recording.forwarders.") && k.endsWith(".endpoint"));
      if (!hasForwarder) {
        throw new IllegalArgumentException(
            "record mode requires at least one recording.forwarders.<name>.endpoint "
                + "(or AZURE_OPENAI_ENDPOINT)");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
