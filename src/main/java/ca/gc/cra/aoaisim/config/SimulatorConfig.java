package ca.gc.cra.aoaisim.config;

import ca.gc.cra.aoaisim.application.port.LimiterKeys;
import ca.gc.cra.aoaisim.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Effective simulator configuration, immutable after startup.
 *
 * @param mode response-producing strategy
 * @param apiKey shared key accepted through the {@code api-key} and {@code ocp-apim-subscription-key} headers
 * @param server HTTP listener settings
 * @param deployments simulated OpenAI deployments keyed by name
 * @param docIntelligenceRps Document Intelligence requests admitted per second
 * @param recording record/replay settings
 * @param generation synthetic generation settings
 * @since 0.1.0
 */
public record SimulatorConfig(
    SimulatorMode mode,
    String apiKey,
    ServerConfig server,
    Map<String, DeploymentConfig> deployments,
    int docIntelligenceRps,
    RecordingConfig recording,
    GenerationConfig generation) {

  static final String DEFAULT_HOST = "0.0.0.0";
  static final int DEFAULT_PORT = 8000;
  static final int DEFAULT_WORKER_THREADS = 1;
  static final int DEFAULT_MAX_CONTENT_LENGTH = 10 * 1024 * 1024;
  static final int DEFAULT_DOC_INTELLIGENCE_RPS = 15;
  static final String DEFAULT_RECORDING_DIR = ".recording";
  static final String DEFAULT_KEY_HEADER = "api-key";
  static final String DEFAULT_PATH_PREFIX = "/openai/";

  private static final String DEPLOYMENTS_PREFIX = "openai.deployments.";
  private static final String FORWARDERS_PREFIX = "recording.forwarders.";

  public SimulatorConfig {
    Objects.requireNonNull(mode, "mode");
    apiKey = Strings.requireNonBlank("apiKey", apiKey);
    Objects.requireNonNull(server, "server");
    deployments = deployments == null ? Map.of() : Map.copyOf(deployments);
    Objects.requireNonNull(recording, "recording");
    Objects.requireNonNull(generation, "generation");
  }

  /**
   * Builds a configuration from flattened key/value pairs, applying defaults for absent keys.
   *
   * @param args flattened configuration (see {@link DefaultSettings})
   * @return validated configuration
   * @throws IllegalArgumentException when a value is missing or out of range
   */
  public static SimulatorConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : new LinkedHashMap<>(args);

    SimulatorMode mode = SimulatorMode.from(kv.get("mode"));
    String apiKey = kv.get("apiKey");
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("apiKey is required (set apiKey=... or SIMULATOR_API_KEY)");
    }

    ServerConfig server = new ServerConfig(
        ConfigValues.string(kv, "server.host", DEFAULT_HOST),
        ConfigValues.boundedInt(kv, "server.port", DEFAULT_PORT, 0, 65_535),
        ConfigValues.boundedInt(kv, "server.workerThreads", DEFAULT_WORKER_THREADS, 1, 256),
        ConfigValues.boundedInt(
            kv, "server.maxContentLength", DEFAULT_MAX_CONTENT_LENGTH, 1_024, 1 << 30));

    Map<String, DeploymentConfig> deployments = new LinkedHashMap<>();
    for (String name : ConfigValues.childNames(kv, DEPLOYMENTS_PREFIX)) {
      String base = DEPLOYMENTS_PREFIX + name + '.';
      if (!kv.containsKey(base + "tokensPerMinute")) {
        throw new IllegalArgumentException(base + "tokensPerMinute is required");
      }
      deployments.put(name, new DeploymentConfig(
          name,
          kv.get(base + "model"),
          ConfigValues.boundedLong(kv, base + "tokensPerMinute", 0, 0, Long.MAX_VALUE),
          ConfigValues.boundedInt(
              kv, base + "embeddingSize", DeploymentConfig.DEFAULT_EMBEDDING_SIZE, 1, 65_536)));
    }

    int docIntelligenceRps = ConfigValues.boundedInt(
        kv, "docIntelligence.rps", DEFAULT_DOC_INTELLIGENCE_RPS, 0, 1_000_000);

    List<ForwarderConfig> forwarders = new ArrayList<>();
    for (String name : ConfigValues.childNames(kv, FORWARDERS_PREFIX)) {
      String base = FORWARDERS_PREFIX + name + '.';
      forwarders.add(new ForwarderConfig(
          name,
          ForwarderConfig.parseEndpoint(base + "endpoint", kv.get(base + "endpoint")),
          kv.get(base + "apiKey"),
          ConfigValues.string(kv, base + "keyHeader", DEFAULT_KEY_HEADER),
          ConfigValues.string(kv, base + "pathPrefix", DEFAULT_PATH_PREFIX),
          ConfigValues.string(kv, base + "limiter", LimiterKeys.OPENAI)));
    }
    RecordingConfig recording = new RecordingConfig(
        parsePath("recording.dir", ConfigValues.string(kv, "recording.dir", DEFAULT_RECORDING_DIR)),
        ConfigValues.bool(kv, "recording.autosave", true),
        forwarders);

    String seedRaw = kv.get("generation.seed");
    OptionalLong seed = seedRaw == null || seedRaw.isBlank()
        ? OptionalLong.empty()
        : OptionalLong.of(ConfigValues.boundedLong(kv, "generation.seed", 0, Long.MIN_VALUE, Long.MAX_VALUE));
    GenerationConfig generation = new GenerationConfig(
        ConfigValues.boundedInt(
            kv, "generation.defaultMaxTokens", GenerationConfig.DEFAULT_MAX_TOKENS, 10, 100_000),
        ConfigValues.boundedInt(kv, "generation.latency.msPerCompletionToken", 0, 0, 10_000),
        ConfigValues.boundedInt(kv, "generation.latency.embeddingMs", 0, 0, 600_000),
        seed);

    return new SimulatorConfig(
        mode, apiKey.trim(), server, deployments, docIntelligenceRps, recording, generation);
  }

  /**
   * Looks up a deployment by name.
   *
   * @param name deployment name from the request path
   * @return deployment settings when configured
   */
  public Optional<DeploymentConfig> deployment(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(deployments.get(name));
  }

  /**
   * Renders the configuration as a JSON-friendly tree with every credential omitted.
   *
   * @return nested maps, lists and scalars
   */
  public Map<String, Object> toRedactedView() {
    Map<String, Object> view = new LinkedHashMap<>();
    view.put("mode", mode.label());
    Map<String, Object> serverView = new LinkedHashMap<>();
    serverView.put("host", server.host());
    serverView.put("port", server.port());
    serverView.put("workerThreads", server.workerThreads());
    serverView.put("maxContentLength", server.maxContentLength());
    view.put("server", serverView);

    Map<String, Object> deploymentView = new LinkedHashMap<>();
    deployments.values().stream()
        .sorted((a, b) -> a.name().compareTo(b.name()))
        .forEach(d -> {
          Map<String, Object> entry = new LinkedHashMap<>();
          entry.put("model", d.model());
          entry.put("tokensPerMinute", d.tokensPerMinute());
          entry.put("embeddingSize", d.embeddingSize());
          deploymentView.put(d.name(), entry);
        });
    view.put("openaiDeployments", deploymentView);
    view.put("docIntelligenceRps", docIntelligenceRps);

    Map<String, Object> recordingView = new LinkedHashMap<>();
    recordingView.put("dir", recording.directory().toString());
    recordingView.put("autosave", recording.autosave());
    List<Object> forwarderView = new ArrayList<>();
    for (ForwarderConfig forwarder : recording.forwarders()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", forwarder.name());
      entry.put("endpoint", forwarder.endpoint().toString());
      entry.put("pathPrefix", forwarder.pathPrefix());
      entry.put("limiter", forwarder.limiterKey());
      forwarderView.add(entry);
    }
    recordingView.put("forwarders", forwarderView);
    view.put("recording", recordingView);

    Map<String, Object> generationView = new LinkedHashMap<>();
    generationView.put("defaultMaxTokens", generation.defaultMaxTokens());
    generationView.put("msPerCompletionToken", generation.msPerCompletionToken());
    generationView.put("embeddingMs", generation.embeddingMs());
    view.put("generation", generationView);
    return view;
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
