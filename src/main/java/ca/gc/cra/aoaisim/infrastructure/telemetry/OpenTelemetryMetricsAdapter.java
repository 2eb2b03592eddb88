package ca.gc.cra.aoaisim.infrastructure.telemetry;

import ca.gc.cra.aoaisim.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that records the simulator's request histograms through OpenTelemetry.
 *
 * <p>Latency histograms are in seconds and tagged {@code status_code} and {@code deployment}; token histograms
 * are tagged {@code deployment}. The deployment attribute is omitted when unknown.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort {
  public static final String LATENCY_BASE = "aoai-simulator.latency.base";
  public static final String LATENCY_FULL = "aoai-simulator.latency.full";
  public static final String TOKENS_REQUESTED = "aoai-simulator.tokens_requested";
  public static final String TOKENS_USED = "aoai-simulator.tokens_used";

  static final AttributeKey<Long> STATUS_CODE = AttributeKey.longKey("status_code");
  static final AttributeKey<String> DEPLOYMENT = AttributeKey.stringKey("deployment");

  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);

  private final MetricsDelegate delegate;

  /**
   * Creates an adapter over the bootstrap's meter.
   *
   * @param bootstrap providers built at startup
   */
  public OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    Objects.requireNonNull(bootstrap, "bootstrap");
    if (!bootstrap.metricsActive()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
      this.delegate = NoopDelegate.INSTANCE;
    } else {
      this.delegate = new OtelDelegate(bootstrap.meter());
    }
  }

  @Override
  public void observeBaseLatency(double seconds, int statusCode, Optional<String> deployment) {
    delegate.latency(true, seconds, statusCode, deployment);
  }

  @Override
  public void observeFullLatency(double seconds, int statusCode, Optional<String> deployment) {
    delegate.latency(false, seconds, statusCode, deployment);
  }

  @Override
  public void observeTokensRequested(long tokens, Optional<String> deployment) {
    delegate.tokens(true, tokens, deployment);
  }

  @Override
  public void observeTokensUsed(long tokens, Optional<String> deployment) {
    delegate.tokens(false, tokens, deployment);
  }

  private interface MetricsDelegate {
    void latency(boolean base, double seconds, int statusCode, Optional<String> deployment);

    void tokens(boolean requested, long tokens, Optional<String> deployment);
  }

  private static final class NoopDelegate implements MetricsDelegate {
    private static final NoopDelegate INSTANCE = new NoopDelegate();

    @Override
    public void latency(boolean base, double seconds, int statusCode, Optional<String> deployment) {
      // no-op
    }

    @Override
    public void tokens(boolean requested, long tokens, Optional<String> deployment) {
      // no-op
    }
  }

  private static final class OtelDelegate implements MetricsDelegate {
    private final DoubleHistogram baseLatency;
    private final DoubleHistogram fullLatency;
    private final LongHistogram tokensRequested;
    private final LongHistogram tokensUsed;

    private OtelDelegate(Meter meter) {
      Objects.requireNonNull(meter, "meter");
      this.baseLatency = meter.histogramBuilder(LATENCY_BASE)
          .setUnit("s")
          .setDescription("Time from authentication to limiter resolution")
          .build();
      this.fullLatency = meter.histogramBuilder(LATENCY_FULL)
          .setUnit("s")
          .setDescription("Time from authentication to the end of latency emulation")
          .build();
      this.tokensRequested = meter.histogramBuilder(TOKENS_REQUESTED)
          .ofLongs()
          .setUnit("{token}")
          .setDescription("Tokens attributed to each request")
          .build();
      this.tokensUsed = meter.histogramBuilder(TOKENS_USED)
          .ofLongs()
          .setUnit("{token}")
          .setDescription("Tokens attributed to each successful request")
          .build();
    }

    @Override
    public void latency(boolean base, double seconds, int statusCode, Optional<String> deployment) {
      AttributesBuilder attributes = Attributes.builder().put(STATUS_CODE, (long) statusCode);
      deployment.ifPresent(d -> attributes.put(DEPLOYMENT, d));
      (base ? baseLatency : fullLatency).record(seconds, attributes.build());
    }

    @Override
    public void tokens(boolean requested, long tokens, Optional<String> deployment) {
      Attributes attributes = deployment.map(d -> Attributes.of(DEPLOYMENT, d)).orElse(Attributes.empty());
      (requested ? tokensRequested : tokensUsed).record(tokens, attributes);
    }
  }
}
