package ca.gc.cra.aoaisim.config;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.pipeline.CredentialValidator;
import ca.gc.cra.aoaisim.application.pipeline.LatencyEmulator;
import ca.gc.cra.aoaisim.application.pipeline.LimiterRegistry;
import ca.gc.cra.aoaisim.application.pipeline.MetricsRecorder;
import ca.gc.cra.aoaisim.application.pipeline.ModeDispatcher;
import ca.gc.cra.aoaisim.application.pipeline.RequestPipeline;
import ca.gc.cra.aoaisim.application.pipeline.SimulatorRouter;
import ca.gc.cra.aoaisim.application.port.AdmissionLimiter;
import ca.gc.cra.aoaisim.application.port.ClockPort;
import ca.gc.cra.aoaisim.application.port.LimiterKeys;
import ca.gc.cra.aoaisim.application.port.ResponseGenerator;
import ca.gc.cra.aoaisim.application.port.UpstreamForwarder;
import ca.gc.cra.aoaisim.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.aoaisim.infrastructure.generate.DocIntelligenceAnalyzeGenerator;
import ca.gc.cra.aoaisim.infrastructure.generate.GeneratorChain;
import ca.gc.cra.aoaisim.infrastructure.generate.OpenAiChatCompletionGenerator;
import ca.gc.cra.aoaisim.infrastructure.generate.OpenAiCompletionGenerator;
import ca.gc.cra.aoaisim.infrastructure.generate.OpenAiEmbeddingGenerator;
import ca.gc.cra.aoaisim.infrastructure.http.NettySimulatorServer;
import ca.gc.cra.aoaisim.infrastructure.limiter.DocIntelligenceLimiter;
import ca.gc.cra.aoaisim.infrastructure.limiter.FixedWindowCounter;
import ca.gc.cra.aoaisim.infrastructure.limiter.OpenAiDeploymentLimiter;
import ca.gc.cra.aoaisim.infrastructure.recording.HttpUpstreamForwarder;
import ca.gc.cra.aoaisim.infrastructure.recording.RecordReplayHandler;
import ca.gc.cra.aoaisim.infrastructure.recording.YamlRecordingStore;
import ca.gc.cra.aoaisim.infrastructure.scheduling.ScheduledExecutorDelayScheduler;
import ca.gc.cra.aoaisim.infrastructure.telemetry.OpenTelemetryBootstrap;
import ca.gc.cra.aoaisim.infrastructure.telemetry.OpenTelemetryMetricsAdapter;
import ca.gc.cra.aoaisim.infrastructure.telemetry.OpenTelemetryTraceAdapter;
import ca.gc.cra.aoaisim.infrastructure.time.SystemClockAdapter;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the simulator from its effective configuration.
 * <p><strong>Role:</strong> Composition root shared by the {@code serve} command and the integration tests.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the producers for the active mode: generators, or the record/replay handler and its forwarders.</li>
 *   <li>Register the {@code openai} and {@code docintelligence} limiters.</li>
 *   <li>Assemble the request pipeline, the router and the Netty listener.</li>
 *   <li>Share the Netty worker group with the latency emulator so delays run on event loop timers.</li>
 * </ul>
 * <p><strong>Lifecycle:</strong> {@link #start()} loads recordings and binds the port; {@link #close()} is
 * idempotent and releases everything in reverse order, saving pending recordings first.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final SimulatorConfig config;
  private final OpenTelemetryBootstrap.BootstrapResult telemetry;
  private final EventLoopGroup workerGroup;
  private final RecordReplayHandler recordReplay;
  private final RequestPipeline pipeline;
  private final SimulatorRouter router;
  private final NettySimulatorServer server;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Wires the simulator with telemetry configured from system properties and the environment.
   *
   * @param config effective configuration
   */
  public CompositionRoot(SimulatorConfig config) {
    this(config, OpenTelemetryBootstrap.initialize(), new SystemClockAdapter(), Clock.systemUTC());
  }

  /**
   * Wires the simulator with explicit telemetry and clocks.
   *
   * @param config effective configuration
   * @param telemetry telemetry providers; closed with this root
   * @param clock monotonic clock for latency and limiter windows
   * @param wallClock wall clock for timestamps in generated bodies
   */
  public CompositionRoot(
      SimulatorConfig config,
      OpenTelemetryBootstrap.BootstrapResult telemetry,
      ClockPort clock,
      Clock wallClock) {
    this.config = Objects.requireNonNull(config, "config");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(wallClock, "wallClock");

    JsonSupport json = new JsonSupport();
    this.workerGroup = new NioEventLoopGroup(
        config.server().workerThreads(),
        ExecutorFactories.namedThreads("aoai-sim-io", false, CompositionRoot::logUncaught));

    this.recordReplay = new RecordReplayHandler(
        config.mode(),
        config.recording().autosave(),
        new YamlRecordingStore(config.recording().directory()),
        forwarders(config, clock, json),
        ExecutorFactories.newRecordingWriter("aoai-sim-recording", CompositionRoot::logUncaught));

    Random random = config.generation().seed().isPresent()
        ? new Random(config.generation().seed().getAsLong())
        : new Random();
    List<ResponseGenerator> generators = List.of(
        new OpenAiChatCompletionGenerator(config.generation(), json, random, wallClock),
        new OpenAiCompletionGenerator(config.generation(), json, random, wallClock),
        new OpenAiEmbeddingGenerator(config.generation(), json, random, wallClock),
        new DocIntelligenceAnalyzeGenerator(json, random, wallClock));

    FixedWindowCounter counter = new FixedWindowCounter(clock);
    Map<String, AdmissionLimiter> limiters = new LinkedHashMap<>();
    limiters.put(LimiterKeys.OPENAI, new OpenAiDeploymentLimiter(config.deployments(), counter, json));
    limiters.put(
        LimiterKeys.DOC_INTELLIGENCE, new DocIntelligenceLimiter(config.docIntelligenceRps(), counter, json));

    CredentialValidator credentials = new CredentialValidator(config.apiKey());
    this.pipeline = new RequestPipeline(
        config,
        credentials,
        new ModeDispatcher(config.mode(), new GeneratorChain(generators), recordReplay),
        new LimiterRegistry(limiters),
        new LatencyEmulator(clock, new ScheduledExecutorDelayScheduler(workerGroup)),
        new MetricsRecorder(new OpenTelemetryMetricsAdapter(telemetry)),
        clock);
    this.router = new SimulatorRouter(
        config, credentials, pipeline, recordReplay, new OpenTelemetryTraceAdapter(telemetry), json);
    this.server = new NettySimulatorServer(config.server(), workerGroup, router::route);
  }

  /**
   * Loads replay recordings and binds the listener.
   *
   * @throws IOException when recordings cannot be loaded
   * @throws InterruptedException when interrupted while binding
   */
  public void start() throws IOException, InterruptedException {
    recordReplay.open();
    server.start();
    log.info(
        "aoai-simulator started in {} mode with {} deployment(s)",
        config.mode().label(),
        config.deployments().size());
  }

  public SimulatorConfig config() {
    return config;
  }

  public SimulatorRouter router() {
    return router;
  }

  public RequestPipeline pipeline() {
    return pipeline;
  }

  public NettySimulatorServer server() {
    return server;
  }

  public RecordReplayHandler recordReplay() {
    return recordReplay;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    server.stop();
    recordReplay.close();
    workerGroup.shutdownGracefully().syncUninterruptibly();
    telemetry.close();
    log.info("aoai-simulator stopped");
  }

  private static List<UpstreamForwarder> forwarders(SimulatorConfig config, ClockPort clock, JsonSupport json) {
    if (config.mode() != SimulatorMode.RECORD || config.recording().forwarders().isEmpty()) {
      return List.of();
    }
    HttpClient client = HttpUpstreamForwarder.newHttpClient();
    List<UpstreamForwarder> forwarders = new ArrayList<>();
    for (ForwarderConfig forwarder : config.recording().forwarders()) {
      forwarders.add(new HttpUpstreamForwarder(forwarder, client, clock, json));
      log.info("Recording {} traffic under {} via {}", forwarder.name(), forwarder.pathPrefix(), forwarder.endpoint());
    }
    return forwarders;
  }

  private static void logUncaught(Thread thread, Throwable ex) {
    log.error("Uncaught exception on {}", thread.getName(), ex);
  }
}
