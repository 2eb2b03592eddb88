package ca.gc.cra.aoaisim.infrastructure.limiter;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.AdmissionLimiter;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.DeploymentConfig;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-deployment admission control for OpenAI routes.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Charge one request against {@code ceil(tokensPerMinute / 1000)} requests per ten seconds.</li>
 *   <li>Charge the request's tokens against {@code tokensPerMinute} per minute.</li>
 *   <li>Deny with 429, {@code Retry-After} and {@code retry-after-ms} when either quota is exhausted.</li>
 *   <li>Annotate admitted responses with {@code x-ratelimit-remaining-requests} and
 *   {@code x-ratelimit-remaining-tokens}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Counters are synchronized inside {@link FixedWindowCounter}.</p>
 *
 * @since 0.1.0
 */
public final class OpenAiDeploymentLimiter implements AdmissionLimiter {
  static final Duration REQUEST_WINDOW = Duration.ofSeconds(10);
  static final Duration TOKEN_WINDOW = Duration.ofMinutes(1);
  static final String DENIAL_MESSAGE =
      "Requests to the OpenAI API Simulator have exceeded call rate limit. "
          + "Please retry after {seconds} seconds.";

  private static final Logger log = LoggerFactory.getLogger(OpenAiDeploymentLimiter.class);

  private final Map<String, DeploymentConfig> deployments;
  private final FixedWindowCounter counter;
  private final JsonSupport json;

  /**
   * Creates a limiter for the configured deployments.
   *
   * @param deployments deployments keyed by name
   * @param counter window counter
   * @param json JSON renderer for denial bodies
   */
  public OpenAiDeploymentLimiter(
      Map<String, DeploymentConfig> deployments, FixedWindowCounter counter, JsonSupport json) {
    this.deployments = Map.copyOf(Objects.requireNonNull(deployments, "deployments"));
    this.counter = Objects.requireNonNull(counter, "counter");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public Optional<SimulatorResponse> check(RequestContext context, SimulatorResponse response) {
    Optional<String> name = context.deploymentName();
    if (name.isEmpty()) {
      log.warn("OpenAI limiter selected for {} without a deployment name; not limiting",
          context.request().path());
      return Optional.empty();
    }
    DeploymentConfig deployment = deployments.get(name.get());
    if (deployment == null) {
      log.warn("Deployment '{}' is not configured; not limiting", name.get());
      return Optional.empty();
    }

    long tokens = context.tokenCount().orElse(0L);
    FixedWindowCounter.Decision decision = counter.tryAcquire(List.of(
        new FixedWindowCounter.Quota(
            "openai:" + deployment.name() + ":requests",
            deployment.requestsPerTenSeconds(),
            REQUEST_WINDOW,
            1),
        new FixedWindowCounter.Quota(
            "openai:" + deployment.name() + ":tokens",
            deployment.tokensPerMinute(),
            TOKEN_WINDOW,
            tokens)));

    if (!decision.granted()) {
      log.debug("Rate limit exceeded for deployment {} ({} tokens requested)", deployment.name(), tokens);
      return Optional.of(RateLimitResponses.tooManyRequests(json, DENIAL_MESSAGE, decision.retryAfter()));
    }
    return Optional.of(response.withHeaders(Map.of(
        "x-ratelimit-remaining-requests", Long.toString(decision.remaining().get(0)),
        "x-ratelimit-remaining-tokens", Long.toString(decision.remaining().get(1)))));
  }
}
