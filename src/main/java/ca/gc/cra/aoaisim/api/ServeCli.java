package ca.gc.cra.aoaisim.api;

import ca.gc.cra.aoaisim.config.CompositionRoot;
import ca.gc.cra.aoaisim.config.ConfigMerger;
import ca.gc.cra.aoaisim.config.DefaultSettings;
import ca.gc.cra.aoaisim.config.DeploymentConfig;
import ca.gc.cra.aoaisim.config.EnvironmentOverrides;
import ca.gc.cra.aoaisim.config.ForwarderConfig;
import ca.gc.cra.aoaisim.config.SimulatorConfig;
import ca.gc.cra.aoaisim.config.YamlConfigLoader;
import ca.gc.cra.aoaisim.logging.LoggingConfigurator;
import ca.gc.cra.aoaisim.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the simulator from a YAML file, environment variables and {@code key=value} overrides.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  static final String DEFAULT_CONFIG_FILE = "simulator.yaml";

  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: serve [config=PATH] [mode=generate|record|replay] [apiKey=KEY] [server.port=0-65535] "
          + "[key=value ...] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      aoai-simulator serve

      Usage:
        serve [config=PATH] [key=value ...] [flags]

      Settings (YAML keys, overridable as key=value; precedence CLI > env > YAML > defaults):
        config=PATH                         YAML file (default ./simulator.yaml when present)
        mode=generate|record|replay         Response source (env SIMULATOR_MODE; default generate)
        apiKey=KEY                          Required shared key (env SIMULATOR_API_KEY)
        server.host=ADDR                    Bind address (default 0.0.0.0)
        server.port=0-65535                 Listen port (env SIMULATOR_PORT; default 8000)
        server.workerThreads=1-256          Netty worker event loops (default 1)
        server.maxContentLength=BYTES       Largest accepted request body (default 10 MiB)
        openai.deployments.NAME.tokensPerMinute=N
                                            Token quota; request quota is ceil(N/1000) per 10s
        openai.deployments.NAME.model=ID    Model reported in generated bodies (default NAME)
        openai.deployments.NAME.embeddingSize=N
                                            Embedding vector length (default 1536)
        docIntelligence.rps=N               Document Intelligence requests per second (default 15)
        recording.dir=PATH                  Recording directory (env RECORDING_DIR; default .recording)
        recording.autosave=true|false       Save after every recorded exchange (default true)
        recording.forwarders.NAME.endpoint=URL
        recording.forwarders.NAME.apiKey=KEY
        recording.forwarders.NAME.keyHeader=HEADER      (default api-key)
        recording.forwarders.NAME.pathPrefix=/PREFIX/   (default /openai/)
        recording.forwarders.NAME.limiter=openai|docintelligence
        generation.defaultMaxTokens=N       Upper bound for unsized completions (default 250)
        generation.latency.msPerCompletionToken=MS
        generation.latency.embeddingMs=MS
        generation.seed=N                   Seed for reproducible generated content

      Telemetry:
        metricsExporter=otlp|none           Metrics exporter (default none)
        tracesExporter=otlp|none            Trace exporter (default none)
        otelEndpoint=URL                    OTLP gRPC endpoint
        otelResourceAttributes=K=V,...      Extra resource attributes

      Flags:
        --dry-run                           Validate configuration, print the plan and exit
        --verbose                           Enable DEBUG logging
        --help                              Show this message
      """;

  private ServeCli() {}

  /**
   * Runs the command against the process environment.
   *
   * @param args command arguments after {@code serve}
   * @return exit code
   */
  static ExitCode run(String[] args) {
    return run(args, EnvironmentOverrides.fromEnvironment());
  }

  /**
   * Runs the command with explicit environment overrides.
   *
   * @param args command arguments after {@code serve}
   * @param env settings derived from environment variables
   * @return exit code
   */
  static ExitCode run(String[] args, Map<String, String> env) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.printLines(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArray());
      TelemetryConfigurator.configure(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.printLines(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    SimulatorConfig config;
    try {
      Optional<Map<String, String>> yaml = loadYaml(kv.remove("config"));
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          yaml, env, kv, DefaultSettings.asFlatMap(), log::warn);
      config = SimulatorConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid simulator configuration: {}", ex.getMessage());
      CliPrinter.printLines(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if (input.hasFlag(CliInput.DRY_RUN)) {
      CliPrinter.printLines(dryRunPlan(config).toArray(String[]::new));
      return ExitCode.SUCCESS;
    }
    return serve(config);
  }

  private static ExitCode serve(SimulatorConfig config) {
    CompositionRoot root = new CompositionRoot(config);
    CountDownLatch stopped = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested");
      root.close();
      stopped.countDown();
    }, "aoai-sim-shutdown");
    try {
      root.start();
      Runtime.getRuntime().addShutdownHook(hook);
      stopped.await();
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Simulator I/O failure: {}", ex.getMessage(), ex);
      root.close();
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Interrupted; shutting down simulator");
      root.close();
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in simulator", ex);
      root.close();
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Optional<Map<String, String>> loadYaml(String explicitPath) throws IOException {
    if (explicitPath == null || explicitPath.isBlank()) {
      Path fallback = Path.of(DEFAULT_CONFIG_FILE);
      if (Files.exists(fallback)) {
        log.info("Loading configuration from {}", fallback.toAbsolutePath());
      }
      return YamlConfigLoader.load(fallback);
    }
    Path path;
    try {
      path = Path.of(explicitPath.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("config is not a valid path: " + explicitPath, ex);
    }
    if (!Files.isRegularFile(path)) {
      throw new IOException("config file not found: " + path);
    }
    log.info("Loading configuration from {}", path.toAbsolutePath());
    return YamlConfigLoader.load(path);
  }

  static List<String> dryRunPlan(SimulatorConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("Serve dry-run: configuration is valid; no listener was started.");
    lines.add(" Mode             : " + config.mode().label());
    lines.add(" API key          : " + Logs.mask(config.apiKey()));
    lines.add(" Listen           : " + config.server().host() + ":" + config.server().port());
    lines.add(" Worker threads   : " + config.server().workerThreads());
    lines.add(" Max body bytes   : " + config.server().maxContentLength());
    if (config.deployments().isEmpty()) {
      lines.add(" Deployments      : <none>");
    }
    config.deployments().values().stream()
        .sorted((a, b) -> a.name().compareTo(b.name()))
        .map(ServeCli::describe)
        .forEach(lines::add);
    lines.add(" Doc Intelligence : " + config.docIntelligenceRps() + " requests/s");
    lines.add(" Recording dir    : " + config.recording().directory()
        + " (autosave=" + config.recording().autosave() + ")");
    for (ForwarderConfig forwarder : config.recording().forwarders()) {
      lines.add(" Forwarder        : " + forwarder.name() + " " + forwarder.pathPrefix() + " -> "
          + forwarder.endpoint() + " [" + forwarder.keyHeader() + "=" + Logs.mask(forwarder.apiKey()) + "]");
    }
    lines.add(" Re-run without --dry-run to start the simulator.");
    return lines;
  }

  private static String describe(DeploymentConfig deployment) {
    return " Deployment       : " + deployment.name() + " (model " + deployment.model() + ", "
        + deployment.tokensPerMinute() + " tokens/min, " + deployment.requestsPerTenSeconds()
        + " requests/10s)";
  }
}
