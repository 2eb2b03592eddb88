package ca.gc.cra.aoaisim.application.port;

import java.util.Optional;

/**
 * <strong>What:</strong> Process-wide handle on the simulator's four request histograms.
 * <p><strong>Why:</strong> Keeps the pipeline independent of the telemetry SDK and lets tests observe recordings
 * directly.</p>
 * <p><strong>Role:</strong> Port consumed by the metrics recorder; implemented by the OpenTelemetry adapter.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent recording from every event loop.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Records time from authentication to limiter resolution.
   *
   * @param seconds elapsed seconds
   * @param statusCode final HTTP status
   * @param deployment deployment name when known
   */
  void observeBaseLatency(double seconds, int statusCode, Optional<String> deployment);

  /**
   * Records time from authentication to the end of latency emulation.
   *
   * @param seconds elapsed seconds
   * @param statusCode final HTTP status
   * @param deployment deployment name when known
   */
  void observeFullLatency(double seconds, int statusCode, Optional<String> deployment);

  /**
   * Records tokens attributed to a request regardless of outcome.
   *
   * @param tokens token count
   * @param deployment deployment name when known
   */
  void observeTokensRequested(long tokens, Optional<String> deployment);

  /**
   * Records tokens attributed to a successful request.
   *
   * @param tokens token count
   * @param deployment deployment name when known
   */
  void observeTokensUsed(long tokens, Optional<String> deployment);

  /** Metrics sink that drops every observation. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override
    public void observeBaseLatency(double seconds, int statusCode, Optional<String> deployment) {}

    @Override
    public void observeFullLatency(double seconds, int statusCode, Optional<String> deployment) {}

    @Override
    public void observeTokensRequested(long tokens, Optional<String> deployment) {}

    @Override
    public void observeTokensUsed(long tokens, Optional<String> deployment) {}
  };
}
