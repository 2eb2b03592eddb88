package ca.gc.cra.aoaisim.infrastructure.generate;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.DeploymentConfig;
import ca.gc.cra.aoaisim.config.GenerationConfig;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/** Synthesizes legacy {@code completions} responses. */
public final class OpenAiCompletionGenerator extends AbstractOpenAiGenerator {
  private final GenerationConfig generation;

  public OpenAiCompletionGenerator(GenerationConfig generation, JsonSupport json, Random random, Clock clock) {
    super(OpenAiRoute.Operation.COMPLETIONS, json, random, clock);
    this.generation = generation;
  }

  @Override
  protected Generated respond(RequestContext context, DeploymentConfig deployment, Map<String, Object> body) {
    Object prompt = body.get("prompt");
    long promptTokens;
    if (prompt instanceof String text) {
      promptTokens = TokenEstimator.estimate(text);
    } else if (prompt instanceof List<?> parts) {
      promptTokens = 0;
      for (Object part : parts) {
        if (!(part instanceof String text)) {
          throw new IllegalArgumentException("prompt must be a string or an array of strings");
        }
        promptTokens += TokenEstimator.estimate(text);
      }
    } else {
      throw new IllegalArgumentException("prompt must be a string or an array of strings");
    }

    CompletionLength length = CompletionLength.choose(body, generation, random);
    Map<String, Object> choice = new LinkedHashMap<>();
    choice.put("text", LoremText.generate(random, length.tokens()));
    choice.put("index", 0);
    choice.put("finish_reason", length.finishReason());
    choice.put("logprobs", null);

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("id", randomId("cmpl-"));
    response.put("object", "text_completion");
    response.put("created", createdEpochSeconds());
    response.put("model", deployment.model());
    response.put("choices", List.of(choice));
    response.put("usage", usage(promptTokens, (long) length.tokens()));
    return new Generated(
        response,
        promptTokens + length.tokens(),
        (long) length.tokens() * generation.msPerCompletionToken());
  }
}
