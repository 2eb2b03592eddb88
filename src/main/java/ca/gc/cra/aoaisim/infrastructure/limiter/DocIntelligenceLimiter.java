package ca.gc.cra.aoaisim.infrastructure.limiter;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.AdmissionLimiter;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import ca.gc.cra.aoaisim.validation.Numbers;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-wide requests-per-second limit for Document Intelligence routes.
 *
 * @since 0.1.0
 */
public final class DocIntelligenceLimiter implements AdmissionLimiter {
  static final Duration WINDOW = Duration.ofSeconds(1);
  static final String DENIAL_MESSAGE = "Rate limit is exceeded. Try again in {seconds} seconds.";
  private static final String COUNTER_KEY = "docintelligence:requests";

  private final long requestsPerSecond;
  private final FixedWindowCounter counter;
  private final JsonSupport json;

  public DocIntelligenceLimiter(long requestsPerSecond, FixedWindowCounter counter, JsonSupport json) {
    this.requestsPerSecond =
        Numbers.requireRange("docIntelligence.rps", requestsPerSecond, 0, Long.MAX_VALUE);
    this.counter = Objects.requireNonNull(counter, "counter");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public Optional<SimulatorResponse> check(RequestContext context, SimulatorResponse response) {
    FixedWindowCounter.Decision decision = counter.tryAcquire(
        List.of(new FixedWindowCounter.Quota(COUNTER_KEY, requestsPerSecond, WINDOW, 1)));
    if (decision.granted()) {
      return Optional.empty();
    }
    return Optional.of(RateLimitResponses.tooManyRequests(json, DENIAL_MESSAGE, decision.retryAfter()));
  }
}
