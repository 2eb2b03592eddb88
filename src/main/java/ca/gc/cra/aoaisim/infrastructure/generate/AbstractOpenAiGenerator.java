package ca.gc.cra.aoaisim.infrastructure.generate;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.LimiterKeys;
import ca.gc.cra.aoaisim.application.port.ResponseGenerator;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.DeploymentConfig;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared flow for synthetic OpenAI deployment operations.
 *
 * <p>Matches {@code POST /openai/deployments/{deployment}/{operation}}, parses the JSON body and tags the request
 * context with the deployment, the {@code openai} limiter and the total token count before delegating to
 * {@link #respond}. Malformed bodies produce a 400 that is not counted against any limiter.</p>
 *
 * @since 0.1.0
 */
abstract class AbstractOpenAiGenerator implements ResponseGenerator {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final OpenAiRoute.Operation operation;
  protected final JsonSupport json;
  protected final Random random;
  protected final Clock clock;

  AbstractOpenAiGenerator(OpenAiRoute.Operation operation, JsonSupport json, Random random, Clock clock) {
    this.operation = Objects.requireNonNull(operation, "operation");
    this.json = Objects.requireNonNull(json, "json");
    this.random = Objects.requireNonNull(random, "random");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public final CompletionStage<Optional<SimulatorResponse>> generate(RequestContext context) {
    SimulatorRequest request = context.request();
    if (!"POST".equals(request.method())) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    Optional<OpenAiRoute> route = OpenAiRoute.parse(request.path());
    if (route.isEmpty() || route.get().operation() != operation) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    String deploymentName = route.get().deployment();
    Map<String, Object> body;
    try {
      body = json.parseObject(request.bodyText());
    } catch (IllegalArgumentException ex) {
      log.debug("Rejecting malformed {} body for deployment {}", operation, deploymentName, ex);
      return CompletableFuture.completedFuture(Optional.of(badRequest("Request body is not a valid JSON object")));
    }

    DeploymentConfig deployment = context.config()
        .deployment(deploymentName)
        .orElseGet(() -> new DeploymentConfig(deploymentName, null, 0, DeploymentConfig.DEFAULT_EMBEDDING_SIZE));
    Generated generated;
    try {
      generated = respond(context, deployment, body);
    } catch (IllegalArgumentException ex) {
      return CompletableFuture.completedFuture(Optional.of(badRequest(ex.getMessage())));
    }

    context.setDeploymentName(deploymentName);
    context.setLimiterKey(LimiterKeys.OPENAI);
    context.setTokenCount(generated.totalTokens());
    if (generated.durationMs() > 0) {
      context.setRecordedDurationMs(generated.durationMs());
    }
    return CompletableFuture.completedFuture(Optional.of(SimulatorResponse.json(200, json.toJson(generated.body()))));
  }

  /**
   * Builds the synthetic response body.
   *
   * @param context request context
   * @param deployment deployment settings; a placeholder when the deployment is not configured
   * @param body parsed request body
   * @return response body with token accounting
   * @throws IllegalArgumentException when the request is well-formed JSON but semantically invalid
   */
  protected abstract Generated respond(RequestContext context, DeploymentConfig deployment, Map<String, Object> body);

  protected long createdEpochSeconds() {
    return clock.instant().getEpochSecond();
  }

  protected String randomId(String prefix) {
    return prefix + Long.toHexString(random.nextLong() & Long.MAX_VALUE);
  }

  protected static Map<String, Object> usage(long promptTokens, Long completionTokens) {
    Map<String, Object> usage = new LinkedHashMap<>();
    usage.put("prompt_tokens", promptTokens);
    if (completionTokens != null) {
      usage.put("completion_tokens", completionTokens);
    }
    usage.put("total_tokens", promptTokens + (completionTokens == null ? 0 : completionTokens));
    return usage;
  }

  protected static int intField(Map<String, Object> body, String name, int fallback) {
    Object value = body.get(name);
    if (value == null) {
      return fallback;
    }
    if (!(value instanceof Number number) || number.doubleValue() != Math.rint(number.doubleValue())) {
      throw new IllegalArgumentException(name + " must be an integer");
    }
    long parsed = number.longValue();
    if (parsed < 1 || parsed > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(name + " must be a positive integer");
    }
    return (int) parsed;
  }

  private SimulatorResponse badRequest(String message) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", "BadRequest");
    error.put("message", message);
    return SimulatorResponse.json(400, json.toJson(Map.of("error", error)));
  }

  /**
   * Synthetic result.
   *
   * @param body response body object graph
   * @param totalTokens tokens charged against the deployment
   * @param durationMs emulated processing time; {@code 0} for none
   */
  protected record Generated(Map<String, Object> body, long totalTokens, long durationMs) {}
}
