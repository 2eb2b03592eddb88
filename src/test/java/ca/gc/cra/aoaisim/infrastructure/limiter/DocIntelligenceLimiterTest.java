package ca.gc.cra.aoaisim.infrastructure.limiter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.RequestTrace;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.SimulatorConfig;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class DocIntelligenceLimiterTest {
  private static final SimulatorResponse ACCEPTED = SimulatorResponse.json(202, "");

  private final AtomicLong now = new AtomicLong(0L);
  private final DocIntelligenceLimiter limiter =
      new DocIntelligenceLimiter(2, new FixedWindowCounter(now::get), new JsonSupport());

  @Test
  void admitsConfiguredRequestsPerSecond() {
    assertTrue(limiter.check(context(), ACCEPTED).isEmpty());
    assertTrue(limiter.check(context(), ACCEPTED).isEmpty());

    SimulatorResponse denied = limiter.check(context(), ACCEPTED).orElseThrow();

    assertEquals(429, denied.status());
    assertEquals("1", denied.header("Retry-After"));
    assertTrue(denied.bodyText().contains("Try again in 1 seconds"));
  }

  @Test
  void nextSecondStartsFresh() {
    limiter.check(context(), ACCEPTED);
    limiter.check(context(), ACCEPTED);
    now.addAndGet(Duration.ofSeconds(1).toNanos());

    assertTrue(limiter.check(context(), ACCEPTED).isEmpty());
  }

  @Test
  void retryAfterIsRoundedUpToWholeSeconds() {
    limiter.check(context(), ACCEPTED);
    limiter.check(context(), ACCEPTED);
    now.addAndGet(Duration.ofMillis(750).toNanos());

    SimulatorResponse denied = limiter.check(context(), ACCEPTED).orElseThrow();

    assertEquals("1", denied.header("Retry-After"));
    assertEquals("250", denied.header("retry-after-ms"));
  }

  private static RequestContext context() {
    SimulatorRequest request = SimulatorRequest.of(
        "POST", "/formrecognizer/documentModels/prebuilt-receipt:analyze", Map.of(), null);
    return new RequestContext(
        SimulatorConfig.fromMap(Map.of("apiKey", "k")), request, RequestTrace.NO_OP, 0L);
  }
}
