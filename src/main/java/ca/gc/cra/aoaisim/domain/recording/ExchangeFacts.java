package ca.gc.cra.aoaisim.domain.recording;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Request facts captured alongside a recorded exchange and restored on replay.
 *
 * @param limiterKey limiter key chosen by the producer, or {@code null}
 * @param deploymentName OpenAI deployment name, or {@code null}
 * @param tokenCount total tokens attributed to the exchange, or {@code null}
 * @since 0.1.0
 */
public record ExchangeFacts(String limiterKey, String deploymentName, Long tokenCount) {
  private static final ExchangeFacts NONE = new ExchangeFacts(null, null, null);

  /** Returns facts with every field absent. */
  public static ExchangeFacts none() {
    return NONE;
  }

  public Optional<String> limiter() {
    return Optional.ofNullable(limiterKey);
  }

  public Optional<String> deployment() {
    return Optional.ofNullable(deploymentName);
  }

  public OptionalLong tokens() {
    return tokenCount == null ? OptionalLong.empty() : OptionalLong.of(tokenCount);
  }
}
