package ca.gc.cra.aoaisim.config;

import java.util.OptionalLong;

/**
 * Knobs for synthetic response generation.
 *
 * @param defaultMaxTokens upper bound for completion length when a request gives no {@code max_tokens}
 * @param msPerCompletionToken emulated upstream latency per generated completion token; {@code 0} disables
 * @param embeddingMs emulated upstream latency for an embeddings call; {@code 0} disables
 * @param seed fixed random seed for reproducible output; empty for a random seed
 * @since 0.1.0
 */
public record GenerationConfig(
    int defaultMaxTokens,
    int msPerCompletionToken,
    int embeddingMs,
    OptionalLong seed) {
  public static final int DEFAULT_MAX_TOKENS = 250;

  public GenerationConfig {
    seed = seed == null ? OptionalLong.empty() : seed;
  }
}
