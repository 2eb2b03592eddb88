package ca.gc.cra.aoaisim.infrastructure.recording;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.ClockPort;
import ca.gc.cra.aoaisim.application.port.ForwardedExchange;
import ca.gc.cra.aoaisim.application.port.UpstreamForwarder;
import ca.gc.cra.aoaisim.config.ForwarderConfig;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import ca.gc.cra.aoaisim.logging.Logs;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards requests under a path prefix to a real upstream service, replacing the caller's credential with the
 * forwarder's own key.
 *
 * <p>Hop-by-hop headers and every inbound credential header are dropped in both directions. The client's
 * {@code Accept-Encoding} is not forwarded, so the upstream answers with an identity-encoded body that can be
 * recorded and inspected as is. The total token count is read from {@code usage.total_tokens} when the upstream
 * answers with JSON.</p>
 *
 * @since 0.1.0
 */
public final class HttpUpstreamForwarder implements UpstreamForwarder {
  static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(120);
  static final int MAX_LOGGED_BODY_BYTES = 512;

  /** Headers never copied between the client and the upstream. */
  static final Set<String> EXCLUDED_HEADERS = Set.of(
      "authorization",
      "api-key",
      "ocp-apim-subscription-key",
      "accept-encoding",
      "host",
      "connection",
      "content-length",
      "expect",
      "keep-alive",
      "proxy-authenticate",
      "proxy-authorization",
      "te",
      "trailer",
      "transfer-encoding",
      "upgrade");

  private static final Logger log = LoggerFactory.getLogger(HttpUpstreamForwarder.class);

  private final ForwarderConfig config;
  private final HttpClient client;
  private final ClockPort clock;
  private final JsonSupport json;
  private final String base;

  public HttpUpstreamForwarder(ForwarderConfig config, HttpClient client, ClockPort clock, JsonSupport json) {
    this.config = Objects.requireNonNull(config, "config");
    this.client = Objects.requireNonNull(client, "client");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.json = Objects.requireNonNull(json, "json");
    String endpoint = config.endpoint().toString();
    this.base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
  }

  /**
   * Creates the HTTP client shared by all forwarders.
   *
   * @return client with a bounded connect timeout
   */
  public static HttpClient newHttpClient() {
    return HttpClient.newBuilder()
        .connectTimeout(CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  /** @return forwarder settings */
  public ForwarderConfig config() {
    return config;
  }

  @Override
  public boolean matches(SimulatorRequest request) {
    return request.path().startsWith(config.pathPrefix());
  }

  @Override
  public CompletionStage<ForwardedExchange> forward(SimulatorRequest request) {
    URI target = URI.create(base + request.pathAndQuery());
    HttpRequest.Builder builder = HttpRequest.newBuilder(target)
        .timeout(REQUEST_TIMEOUT)
        .method(
            request.method(),
            request.body().length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body()));
    request.headers().forEach((name, values) -> {
      if (!EXCLUDED_HEADERS.contains(name)) {
        values.forEach(value -> builder.header(name, value));
      }
    });
    builder.header(config.keyHeader(), config.apiKey());

    long start = clock.nanoTime();
    log.debug("Forwarding {} {} to {} ({})", request.method(), request.path(), config.name(), target.getHost());
    return client.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofByteArray())
        .thenApply(upstream -> {
          long durationMs = TimeUnit.NANOSECONDS.toMillis(Math.max(0L, clock.nanoTime() - start));
          SimulatorResponse response =
              new SimulatorResponse(upstream.statusCode(), responseHeaders(upstream), upstream.body());
          log.debug("Upstream {} answered {} in {} ms", config.name(), upstream.statusCode(), durationMs);
          if (upstream.statusCode() >= 500) {
            log.warn("Upstream {} failed with {}: {}", config.name(), upstream.statusCode(),
                Logs.truncate(response.bodyText(), MAX_LOGGED_BODY_BYTES));
          }
          return new ForwardedExchange(response, durationMs, config.limiterKey(), totalTokens(response));
        });
  }

  private static Map<String, String> responseHeaders(HttpResponse<byte[]> upstream) {
    Map<String, String> headers = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : upstream.headers().map().entrySet()) {
      String name = entry.getKey().toLowerCase(Locale.ROOT);
      if (name.startsWith(":") || EXCLUDED_HEADERS.contains(name) || entry.getValue().isEmpty()) {
        continue;
      }
      headers.put(name, String.join(", ", entry.getValue()));
    }
    return headers;
  }

  OptionalLong totalTokens(SimulatorResponse response) {
    String contentType = response.header(SimulatorResponse.CONTENT_TYPE);
    if (contentType == null || !contentType.toLowerCase(Locale.ROOT).contains("json")
        || response.body().length == 0) {
      return OptionalLong.empty();
    }
    try {
      Object parsed = json.parse(response.bodyText());
      if (parsed instanceof Map<?, ?> root
          && root.get("usage") instanceof Map<?, ?> usage
          && usage.get("total_tokens") instanceof Number total
          && total.longValue() >= 0) {
        return OptionalLong.of(total.longValue());
      }
    } catch (IllegalArgumentException ex) {
      log.debug("Upstream {} returned unparseable JSON; no token count recorded", config.name(), ex);
    }
    return OptionalLong.empty();
  }
}
