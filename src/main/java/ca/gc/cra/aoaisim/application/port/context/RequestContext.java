package ca.gc.cra.aoaisim.application.port.context;

import ca.gc.cra.aoaisim.application.port.RequestTrace;
import ca.gc.cra.aoaisim.config.SimulatorConfig;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Per-request state carried from the response producer to the post-processing stages.
 * <p><strong>Why:</strong> Producers learn facts (deployment, token count, limiter, recorded latency) that the
 * limiter, latency emulator and metrics recorder need later in the same request.</p>
 * <p><strong>Role:</strong> Created by the pipeline right after authentication; discarded with the response.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Owned by exactly one request; hand-offs between threads go
 * through {@link java.util.concurrent.CompletionStage} completion, which orders the writes.</p>
 *
 * @since 0.1.0
 */
public final class RequestContext {
  private final SimulatorConfig config;
  private final SimulatorRequest request;
  private final RequestTrace trace;
  private final long startNanos;

  private String limiterKey;
  private String deploymentName;
  private Long tokenCount;
  private Long recordedDurationMs;

  /**
   * Creates a context for an authenticated request.
   *
   * @param config effective configuration
   * @param request inbound request
   * @param trace span handle for the request
   * @param startNanos monotonic timestamp taken right after authentication
   */
  public RequestContext(
      SimulatorConfig config, SimulatorRequest request, RequestTrace trace, long startNanos) {
    this.config = Objects.requireNonNull(config, "config");
    this.request = Objects.requireNonNull(request, "request");
    this.trace = trace == null ? RequestTrace.NO_OP : trace;
    this.startNanos = startNanos;
  }

  public SimulatorConfig config() {
    return config;
  }

  public SimulatorRequest request() {
    return request;
  }

  public RequestTrace trace() {
    return trace;
  }

  public long startNanos() {
    return startNanos;
  }

  public Optional<String> limiterKey() {
    return Optional.ofNullable(limiterKey);
  }

  public void setLimiterKey(String limiterKey) {
    this.limiterKey = limiterKey;
  }

  public Optional<String> deploymentName() {
    return Optional.ofNullable(deploymentName);
  }

  public void setDeploymentName(String deploymentName) {
    this.deploymentName = deploymentName;
  }

  public OptionalLong tokenCount() {
    return tokenCount == null ? OptionalLong.empty() : OptionalLong.of(tokenCount);
  }

  /**
   * Sets the token count attributed to this request.
   *
   * @param tokens non-negative token count
   */
  public void setTokenCount(long tokens) {
    if (tokens < 0) {
      throw new IllegalArgumentException("tokens must be >= 0 (was " + tokens + ")");
    }
    this.tokenCount = tokens;
  }

  public OptionalLong recordedDurationMs() {
    return recordedDurationMs == null ? OptionalLong.empty() : OptionalLong.of(recordedDurationMs);
  }

  /**
   * Sets the latency hint: the total time, in milliseconds, the response should appear to take.
   *
   * @param durationMs non-negative duration
   */
  public void setRecordedDurationMs(long durationMs) {
    if (durationMs < 0) {
      throw new IllegalArgumentException("durationMs must be >= 0 (was " + durationMs + ")");
    }
    this.recordedDurationMs = durationMs;
  }
}
