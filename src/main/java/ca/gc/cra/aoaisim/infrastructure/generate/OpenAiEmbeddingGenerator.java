package ca.gc.cra.aoaisim.infrastructure.generate;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.DeploymentConfig;
import ca.gc.cra.aoaisim.config.GenerationConfig;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Synthesizes {@code embeddings} responses with one random vector per input, sized by the deployment's
 * {@code embeddingSize}.
 *
 * @since 0.1.0
 */
public final class OpenAiEmbeddingGenerator extends AbstractOpenAiGenerator {
  private final GenerationConfig generation;

  public OpenAiEmbeddingGenerator(GenerationConfig generation, JsonSupport json, Random random, Clock clock) {
    super(OpenAiRoute.Operation.EMBEDDINGS, json, random, clock);
    this.generation = generation;
  }

  @Override
  protected Generated respond(RequestContext context, DeploymentConfig deployment, Map<String, Object> body) {
    List<String> inputs = inputs(body.get("input"));
    long promptTokens = 0;
    List<Object> data = new ArrayList<>(inputs.size());
    for (int i = 0; i < inputs.size(); i++) {
      promptTokens += TokenEstimator.estimate(inputs.get(i));
      float[] vector = new float[deployment.embeddingSize()];
      for (int d = 0; d < vector.length; d++) {
        vector[d] = random.nextFloat() * 2f - 1f;
      }
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("object", "embedding");
      item.put("index", i);
      item.put("embedding", vector);
      data.add(item);
    }

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("object", "list");
    response.put("data", data);
    response.put("model", deployment.model());
    response.put("usage", usage(promptTokens, null));
    return new Generated(response, promptTokens, generation.embeddingMs());
  }

  private static List<String> inputs(Object input) {
    if (input instanceof String text) {
      return List.of(text);
    }
    if (input instanceof List<?> parts && !parts.isEmpty()) {
      List<String> texts = new ArrayList<>(parts.size());
      for (Object part : parts) {
        if (!(part instanceof String text)) {
          throw new IllegalArgumentException("input must be a string or an array of strings");
        }
        texts.add(text);
      }
      return texts;
    }
    throw new IllegalArgumentException("input must be a string or a non-empty array of strings");
  }
}
