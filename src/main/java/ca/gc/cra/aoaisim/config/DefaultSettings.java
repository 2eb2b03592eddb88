package ca.gc.cra.aoaisim.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the flattened default configuration map.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI overrides.</p>
 */
public final class DefaultSettings {
  private static final Map<String, String> DEFAULTS = buildDefaults();

  private DefaultSettings() {}

  /**
   * Returns the flattened defaults.
   *
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("mode", SimulatorMode.GENERATE.label());
    map.put("server.host", SimulatorConfig.DEFAULT_HOST);
    map.put("server.port", Integer.toString(SimulatorConfig.DEFAULT_PORT));
    map.put("server.workerThreads", Integer.toString(SimulatorConfig.DEFAULT_WORKER_THREADS));
    map.put("server.maxContentLength", Integer.toString(SimulatorConfig.DEFAULT_MAX_CONTENT_LENGTH));
    map.put("docIntelligence.rps", Integer.toString(SimulatorConfig.DEFAULT_DOC_INTELLIGENCE_RPS));
    map.put("recording.dir", SimulatorConfig.DEFAULT_RECORDING_DIR);
    map.put("recording.autosave", "true");
    map.put("generation.defaultMaxTokens", Integer.toString(GenerationConfig.DEFAULT_MAX_TOKENS));
    map.put("generation.latency.msPerCompletionToken", "0");
    map.put("generation.latency.embeddingMs", "0");
    return Map.copyOf(map);
  }
}
