package ca.gc.cra.aoaisim.application.pipeline;

import ca.gc.cra.aoaisim.application.port.MetricsPort;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Records the request histograms for a final outcome.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Base latency: authentication to limiter resolution.</li>
 *   <li>Full latency: authentication to the end of latency emulation.</li>
 *   <li>Tokens requested whenever a count is known; tokens used only for status below 300.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; delegates to the thread-safe {@link MetricsPort}.</p>
 * <p><strong>Observability:</strong> Recording failures are logged at WARN and never reach the client.</p>
 *
 * @since 0.1.0
 */
public final class MetricsRecorder {
  private static final Logger log = LoggerFactory.getLogger(MetricsRecorder.class);
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final MetricsPort metrics;

  public MetricsRecorder(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Records a completed request.
   *
   * @param context per-request context
   * @param statusCode final response status
   * @param baseEndNanos timestamp right after limiter resolution
   * @param fullEndNanos timestamp right after latency emulation
   */
  public void record(RequestContext context, int statusCode, long baseEndNanos, long fullEndNanos) {
    Optional<String> deployment = context.deploymentName();
    try {
      metrics.observeBaseLatency(seconds(context, baseEndNanos), statusCode, deployment);
      metrics.observeFullLatency(seconds(context, fullEndNanos), statusCode, deployment);
      OptionalLong tokens = context.tokenCount();
      if (tokens.isPresent()) {
        metrics.observeTokensRequested(tokens.getAsLong(), deployment);
        if (statusCode < 300) {
          metrics.observeTokensUsed(tokens.getAsLong(), deployment);
        }
      }
    } catch (RuntimeException ex) {
      log.warn("Failed to record metrics for {}", context.request().path(), ex);
    }
  }

  /**
   * Records latency for a request that ended in an internal fault. Token histograms are skipped.
   *
   * @param context per-request context
   * @param statusCode status returned for the fault
   * @param endNanos timestamp when the fault was handled
   */
  public void recordFault(RequestContext context, int statusCode, long endNanos) {
    Optional<String> deployment = context.deploymentName();
    try {
      double elapsed = seconds(context, endNanos);
      metrics.observeBaseLatency(elapsed, statusCode, deployment);
      metrics.observeFullLatency(elapsed, statusCode, deployment);
    } catch (RuntimeException ex) {
      log.warn("Failed to record fault metrics for {}", context.request().path(), ex);
    }
  }

  private static double seconds(RequestContext context, long endNanos) {
    return Math.max(0L, endNanos - context.startNanos()) / NANOS_PER_SECOND;
  }
}
