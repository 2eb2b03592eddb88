package ca.gc.cra.aoaisim.infrastructure.limiter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.RequestTrace;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.DeploymentConfig;
import ca.gc.cra.aoaisim.config.SimulatorConfig;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class OpenAiDeploymentLimiterTest {
  private static final SimulatorResponse PRODUCED = SimulatorResponse.json(200, "{}");

  private final AtomicLong now = new AtomicLong(0L);
  private final JsonSupport json = new JsonSupport();
  private final OpenAiDeploymentLimiter limiter = new OpenAiDeploymentLimiter(
      Map.of(
          "small", new DeploymentConfig("small", null, 1_000, 1536),
          "large", new DeploymentConfig("large", null, 10_000, 1536)),
      new FixedWindowCounter(now::get),
      json);

  @Test
  void admittedResponseCarriesRemainingHeaders() {
    SimulatorResponse response = limiter.check(context("large", 2_500), PRODUCED).orElseThrow();

    assertEquals(200, response.status());
    assertEquals("9", response.header("x-ratelimit-remaining-requests"));
    assertEquals("7500", response.header("x-ratelimit-remaining-tokens"));
  }

  @Test
  void requestQuotaIsOnePerThousandTokensPerMinute() {
    limiter.check(context("small", 1), PRODUCED);

    SimulatorResponse denied = limiter.check(context("small", 1), PRODUCED).orElseThrow();

    assertEquals(429, denied.status());
    assertEquals("10", denied.header("Retry-After"));
    assertEquals("10000", denied.header("retry-after-ms"));
    Map<String, Object> body = json.parseObject(denied.bodyText());
    @SuppressWarnings("unchecked")
    Map<String, Object> error = (Map<String, Object>) body.get("error");
    assertEquals("429", error.get("code"));
    assertTrue(((String) error.get("message")).contains("retry after 10 seconds"));
  }

  @Test
  void tokenQuotaIsEnforcedPerMinute() {
    limiter.check(context("large", 6_000), PRODUCED);

    SimulatorResponse denied = limiter.check(context("large", 5_000), PRODUCED).orElseThrow();
    SimulatorResponse smaller = limiter.check(context("large", 4_000), PRODUCED).orElseThrow();

    assertEquals(429, denied.status());
    assertEquals("60", denied.header("Retry-After"));
    assertEquals(200, smaller.status());
    assertEquals("0", smaller.header("x-ratelimit-remaining-tokens"));
  }

  @Test
  void quotaRecoversAfterWindow() {
    limiter.check(context("small", 1_000), PRODUCED);
    now.addAndGet(Duration.ofMinutes(1).toNanos());

    assertEquals(200, limiter.check(context("small", 1_000), PRODUCED).orElseThrow().status());
  }

  @Test
  void unknownDeploymentIsNotLimited() {
    for (int i = 0; i < 5; i++) {
      assertEquals(Optional.empty(), limiter.check(context("other", 100_000), PRODUCED));
    }
  }

  @Test
  void missingDeploymentNameIsNotLimited() {
    assertEquals(Optional.empty(), limiter.check(context(null, 1), PRODUCED));
  }

  private static RequestContext context(String deployment, long tokens) {
    SimulatorConfig config = SimulatorConfig.fromMap(Map.of("apiKey", "k"));
    SimulatorRequest request = SimulatorRequest.of("POST", "/openai/deployments/x/chat/completions", Map.of(), null);
    RequestContext context = new RequestContext(config, request, RequestTrace.NO_OP, 0L);
    if (deployment != null) {
      context.setDeploymentName(deployment);
    }
    context.setTokenCount(tokens);
    return context;
  }
}
