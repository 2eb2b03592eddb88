package ca.gc.cra.aoaisim.application.pipeline;

import ca.gc.cra.aoaisim.application.port.MetricsPort;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/** Captures every metric observation for assertions. */
final class RecordingMetricsPort implements MetricsPort {
  record Latency(double seconds, int statusCode, Optional<String> deployment) {}

  record Tokens(long tokens, Optional<String> deployment) {}

  final List<Latency> baseLatency = new CopyOnWriteArrayList<>();
  final List<Latency> fullLatency = new CopyOnWriteArrayList<>();
  final List<Tokens> tokensRequested = new CopyOnWriteArrayList<>();
  final List<Tokens> tokensUsed = new CopyOnWriteArrayList<>();

  @Override
  public void observeBaseLatency(double seconds, int statusCode, Optional<String> deployment) {
    baseLatency.add(new Latency(seconds, statusCode, deployment));
  }

  @Override
  public void observeFullLatency(double seconds, int statusCode, Optional<String> deployment) {
    fullLatency.add(new Latency(seconds, statusCode, deployment));
  }

  @Override
  public void observeTokensRequested(long tokens, Optional<String> deployment) {
    tokensRequested.add(new Tokens(tokens, deployment));
  }

  @Override
  public void observeTokensUsed(long tokens, Optional<String> deployment) {
    tokensUsed.add(new Tokens(tokens, deployment));
  }

  boolean isEmpty() {
    return baseLatency.isEmpty() && fullLatency.isEmpty() && tokensRequested.isEmpty() && tokensUsed.isEmpty();
  }
}
