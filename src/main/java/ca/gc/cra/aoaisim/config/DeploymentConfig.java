package ca.gc.cra.aoaisim.config;

import ca.gc.cra.aoaisim.validation.Numbers;
import ca.gc.cra.aoaisim.validation.Strings;

/**
 * A simulated OpenAI deployment and its quota.
 *
 * @param name deployment name as it appears in request paths
 * @param model model name reported in generated responses
 * @param tokensPerMinute token quota; {@code 0} denies every request
 * @param embeddingSize vector length returned by the embeddings route
 * @since 0.1.0
 */
public record DeploymentConfig(String name, String model, long tokensPerMinute, int embeddingSize) {
  public static final int DEFAULT_EMBEDDING_SIZE = 1536;

  public DeploymentConfig {
    name = Strings.requireNonBlank("deployment name", name);
    model = model == null || model.isBlank() ? name : model.trim();
    Numbers.requireRange("openai.deployments." + name + ".tokensPerMinute", tokensPerMinute, 0, Long.MAX_VALUE);
    Numbers.requireRange("openai.deployments." + name + ".embeddingSize", embeddingSize, 1, 65_536);
  }

  /** Requests admitted per ten seconds, derived from the token quota as Azure OpenAI does. */
  public long requestsPerTenSeconds() {
    return (tokensPerMinute + 999) / 1000;
  }
}
