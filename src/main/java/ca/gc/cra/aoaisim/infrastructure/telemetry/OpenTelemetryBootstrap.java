package ca.gc.cra.aoaisim.infrastructure.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bootstraps the OpenTelemetry meter and tracer providers for the simulator.
 *
 * <p>Exporters are chosen from {@code otel.metrics.exporter}/{@code OTEL_METRICS_EXPORTER} and
 * {@code otel.traces.exporter}/{@code OTEL_TRACES_EXPORTER} ({@code otlp} or {@code none}, default
 * {@code none}); any bootstrap failure falls back to no-op providers.</p>
 */
public final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.aoaisim";
  private static final String DEFAULT_EXPORTER = "none";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /**
   * Builds providers from system properties and environment variables.
   *
   * @return active or no-op bootstrap result; never {@code null}
   */
  public static BootstrapResult initialize() {
    try {
      BootstrapConfig config = BootstrapConfig.fromEnvironment();
      if (config.metricsExporter() == ExporterMode.NONE && config.tracesExporter() == ExporterMode.NONE) {
        log.info("OpenTelemetry exporters disabled (metrics=none, traces=none)");
        return BootstrapResult.noop();
      }
      return buildActive(config);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry; using noop providers", ex);
      return BootstrapResult.noop();
    }
  }

  /**
   * Builds providers that report to in-memory test collaborators.
   *
   * @param reader metric reader receiving every instrument
   * @param spanProcessor processor receiving every span
   * @return active bootstrap result
   */
  public static BootstrapResult forTesting(MetricReader reader, SpanProcessor spanProcessor) {
    Objects.requireNonNull(reader, "reader");
    Objects.requireNonNull(spanProcessor, "spanProcessor");
    String version = detectServiceVersion();
    Resource resource = buildResource(version, Attributes.empty());
    SdkMeterProvider meterProvider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
        .setResource(resource)
        .addSpanProcessor(spanProcessor)
        .build();
    return BootstrapResult.active(meterProvider, tracerProvider, version);
  }

  private static BootstrapResult buildActive(BootstrapConfig config) {
    SdkMeterProvider meterProvider = null;
    if (config.metricsExporter() == ExporterMode.OTLP) {
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(config.endpoint()).build();
      MetricReader reader =
          PeriodicMetricReader.builder(exporter).setInterval(Duration.ofSeconds(30)).build();
      meterProvider = SdkMeterProvider.builder()
          .setResource(config.resource())
          .registerMetricReader(reader)
          .build();
    }
    SdkTracerProvider tracerProvider = null;
    if (config.tracesExporter() == ExporterMode.OTLP) {
      OtlpGrpcSpanExporter exporter =
          OtlpGrpcSpanExporter.builder().setEndpoint(config.endpoint()).build();
      tracerProvider = SdkTracerProvider.builder()
          .setResource(config.resource())
          .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
          .build();
    }
    log.info(
        "OpenTelemetry initialized with metrics={} traces={} targeting {}",
        config.metricsExporter(),
        config.tracesExporter(),
        config.endpoint());
    return BootstrapResult.active(meterProvider, tracerProvider, config.instrumentationVersion());
  }

  private static Resource buildResource(String version, Attributes additional) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "aoai-simulator")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    String instanceId = detectInstanceId();
    if (!instanceId.isBlank()) {
      builder.put(SERVICE_INSTANCE_ID, instanceId);
    }
    Resource base = Resource.create(builder.build());
    Resource extra = additional.isEmpty() ? Resource.empty() : Resource.create(additional);
    return Resource.getDefault().merge(base).merge(extra);
  }

  private static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int idx = trimmed.indexOf('=');
      if (idx <= 0 || idx == trimmed.length() - 1) {
        log.warn("Ignoring malformed OTEL_RESOURCE_ATTRIBUTES entry: {}", trimmed);
        continue;
      }
      String key = trimmed.substring(0, idx).trim();
      String value = trimmed.substring(idx + 1).trim();
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring OTEL_RESOURCE_ATTRIBUTES entry with blank key/value: {}", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String detectInstanceId() {
    String envOverride = System.getenv("OTEL_RESOURCE_SERVICE_INSTANCE");
    if (envOverride != null && !envOverride.isBlank()) {
      return envOverride.trim();
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Falling back to runtime MXBean for instance id", ex);
      String runtimeName = ManagementFactory.getRuntimeMXBean().getName();
      return runtimeName != null ? runtimeName : "unknown";
    }
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null) {
      String impl = pkg.getImplementationVersion();
      if (impl != null && !impl.isBlank()) {
        return impl;
      }
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/aoai-simulator/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  private static BootstrapConfig buildConfigFromEnvironment() {
    Properties props = System.getProperties();
    ExporterMode metrics = ExporterMode.from(firstNonBlank(
        props.getProperty("otel.metrics.exporter"),
        System.getenv("OTEL_METRICS_EXPORTER"),
        DEFAULT_EXPORTER));
    ExporterMode traces = ExporterMode.from(firstNonBlank(
        props.getProperty("otel.traces.exporter"),
        System.getenv("OTEL_TRACES_EXPORTER"),
        DEFAULT_EXPORTER));
    String endpoint = firstNonBlank(
        props.getProperty("otel.exporter.otlp.endpoint"),
        System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
        DEFAULT_ENDPOINT);
    String resourceAttrs = firstNonBlank(
        props.getProperty("otel.resource.attributes"),
        System.getenv("OTEL_RESOURCE_ATTRIBUTES"),
        "");
    String version = detectServiceVersion();
    Resource resource = buildResource(version, parseResourceAttributes(resourceAttrs));
    return new BootstrapConfig(metrics, traces, endpoint, resource, version);
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  record BootstrapConfig(
      ExporterMode metricsExporter,
      ExporterMode tracesExporter,
      String endpoint,
      Resource resource,
      String instrumentationVersion) {

    static BootstrapConfig fromEnvironment() {
      return buildConfigFromEnvironment();
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown OpenTelemetry exporter value '{}'; defaulting to {}", raw, DEFAULT_EXPORTER);
          yield NONE;
        }
      };
    }
  }

  /**
   * Providers built at startup; closing shuts them down and flushes pending telemetry.
   */
  public static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final Tracer tracer;
    private final SdkMeterProvider meterProvider;
    private final SdkTracerProvider tracerProvider;

    private BootstrapResult(
        Meter meter, Tracer tracer, SdkMeterProvider meterProvider, SdkTracerProvider tracerProvider) {
      this.meter = meter;
      this.tracer = tracer;
      this.meterProvider = meterProvider;
      this.tracerProvider = tracerProvider;
    }

    /** Returns a result whose meter and tracer drop everything. */
    public static BootstrapResult noop() {
      return new BootstrapResult(
          MeterProvider.noop().get(INSTRUMENTATION_SCOPE),
          TracerProvider.noop().get(INSTRUMENTATION_SCOPE),
          null,
          null);
    }

    static BootstrapResult active(
        SdkMeterProvider meterProvider, SdkTracerProvider tracerProvider, String version) {
      Meter meter = meterProvider == null
          ? MeterProvider.noop().get(INSTRUMENTATION_SCOPE)
          : meterProvider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
      Tracer tracer = tracerProvider == null
          ? TracerProvider.noop().get(INSTRUMENTATION_SCOPE)
          : tracerProvider.tracerBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
      return new BootstrapResult(meter, tracer, meterProvider, tracerProvider);
    }

    public Meter meter() {
      return meter;
    }

    public Tracer tracer() {
      return tracer;
    }

    /** {@code true} when neither metrics nor traces are exported. */
    public boolean isNoop() {
      return meterProvider == null && tracerProvider == null;
    }

    boolean metricsActive() {
      return meterProvider != null;
    }

    /** Flushes pending metrics and spans, waiting up to five seconds for each. */
    public void forceFlush() {
      if (meterProvider != null) {
        awaitQuietly(meterProvider.forceFlush(), "metrics flush");
      }
      if (tracerProvider != null) {
        awaitQuietly(tracerProvider.forceFlush(), "span flush");
      }
    }

    @Override
    public void close() {
      try {
        if (meterProvider != null) {
          awaitQuietly(meterProvider.shutdown(), "meter provider shutdown");
        }
        if (tracerProvider != null) {
          awaitQuietly(tracerProvider.shutdown(), "tracer provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry providers cleanly", ex);
      }
    }

    private static void awaitQuietly(CompletableResultCode result, String what) {
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry {} did not complete within timeout", what);
      }
    }
  }
}
