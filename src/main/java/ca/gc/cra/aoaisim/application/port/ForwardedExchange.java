package ca.gc.cra.aoaisim.application.port;

import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Result of an upstream call.
 *
 * @param response upstream response
 * @param durationMs measured round-trip time in milliseconds
 * @param limiterKey limiter configured for the forwarder, or {@code null}
 * @param tokenCount {@code usage.total_tokens} reported by the upstream, when present
 * @since 0.1.0
 */
public record ForwardedExchange(
    SimulatorResponse response, long durationMs, String limiterKey, OptionalLong tokenCount) {

  public ForwardedExchange {
    Objects.requireNonNull(response, "response");
    tokenCount = tokenCount == null ? OptionalLong.empty() : tokenCount;
  }
}
