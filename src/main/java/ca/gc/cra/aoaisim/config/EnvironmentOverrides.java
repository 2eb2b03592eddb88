package ca.gc.cra.aoaisim.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps the simulator's environment variables onto flattened configuration keys.
 *
 * <p>{@code AZURE_OPENAI_ENDPOINT}/{@code AZURE_OPENAI_KEY} define the {@code openai} forwarder and
 * {@code AZURE_FORM_RECOGNIZER_ENDPOINT}/{@code AZURE_FORM_RECOGNIZER_KEY} the {@code docintelligence}
 * forwarder used in record mode.</p>
 */
public final class EnvironmentOverrides {
  private static final Map<String, String> DIRECT = Map.of(
      "SIMULATOR_MODE", "mode",
      "SIMULATOR_API_KEY", "apiKey",
      "RECORDING_DIR", "recording.dir",
      "RECORDING_AUTOSAVE", "recording.autosave",
      "DOC_INTELLIGENCE_RPS", "docIntelligence.rps",
      "SIMULATOR_PORT", "server.port");

  private EnvironmentOverrides() {}

  /**
   * Reads overrides from the process environment.
   *
   * @return flattened overrides; empty when no variable is set
   */
  public static Map<String, String> fromEnvironment() {
    return from(System::getenv);
  }

  /**
   * Reads overrides through the supplied lookup.
   *
   * @param env variable lookup returning {@code null} for unset variables
   * @return flattened overrides
   */
  public static Map<String, String> from(Function<String, String> env) {
    Map<String, String> out = new LinkedHashMap<>();
    DIRECT.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(e -> putIfSet(out, e.getValue(), env.apply(e.getKey())));

    String openAiEndpoint = env.apply("AZURE_OPENAI_ENDPOINT");
    if (isSet(openAiEndpoint)) {
      out.put("recording.forwarders.openai.endpoint", openAiEndpoint.trim());
      putIfSet(out, "recording.forwarders.openai.apiKey", env.apply("AZURE_OPENAI_KEY"));
      out.put("recording.forwarders.openai.keyHeader", "api-key");
      out.put("recording.forwarders.openai.pathPrefix", "/openai/");
      out.put("recording.forwarders.openai.limiter", "openai");
    }

    String docEndpoint = env.apply("AZURE_FORM_RECOGNIZER_ENDPOINT");
    if (isSet(docEndpoint)) {
      out.put("recording.forwarders.docintelligence.endpoint", docEndpoint.trim());
      putIfSet(out, "recording.forwarders.docintelligence.apiKey", env.apply("AZURE_FORM_RECOGNIZER_KEY"));
      out.put("recording.forwarders.docintelligence.keyHeader", "ocp-apim-subscription-key");
      out.put("recording.forwarders.docintelligence.pathPrefix", "/formrecognizer/");
      out.put("recording.forwarders.docintelligence.limiter", "docintelligence");
    }
    return out;
  }

  private static void putIfSet(Map<String, String> out, String key, String value) {
    if (isSet(value)) {
      out.put(key, value.trim());
    }
  }

  private static boolean isSet(String value) {
    return value != null && !value.isBlank();
  }
}
