package ca.gc.cra.aoaisim.api;

import ca.gc.cra.aoaisim.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry CLI options into the system properties read by the OpenTelemetry bootstrap.
 *
 * <table>
 *   <caption>Recognized options</caption>
 *   <tr><th>CLI key</th><th>System property</th></tr>
 *   <tr><td>{@code metricsExporter=otlp|none}</td><td>{@code otel.metrics.exporter}</td></tr>
 *   <tr><td>{@code tracesExporter=otlp|none}</td><td>{@code otel.traces.exporter}</td></tr>
 *   <tr><td>{@code otelEndpoint=URL}</td><td>{@code otel.exporter.otlp.endpoint}</td></tr>
 *   <tr><td>{@code otelResourceAttributes=K=V,...}</td><td>{@code otel.resource.attributes}</td></tr>
 * </table>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies and removes the telemetry keys from {@code args}, leaving simulator settings behind.
   *
   * @param args mutable CLI overrides
   * @throws IllegalArgumentException when a telemetry value is invalid
   */
  static void configure(Map<String, String> args) {
    exporter(args.remove("metricsExporter"), "metricsExporter", "otel.metrics.exporter");
    exporter(args.remove("tracesExporter"), "tracesExporter", "otel.traces.exporter");

    String endpoint = trimmed(args.remove("otelEndpoint"));
    if (endpoint != null) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String resourceAttributes = trimmed(args.remove("otelResourceAttributes"));
    if (resourceAttributes != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
  }

  private static void exporter(String raw, String key, String property) {
    String value = trimmed(raw);
    if (value == null) {
      return;
    }
    String normalized = value.toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException(key + " must be 'otlp' or 'none'");
    }
    log.debug("Configuring {}={}", property, normalized);
    System.setProperty(property, normalized);
  }

  private static void validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String trimmed(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
