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

/**
 * Synthesizes {@code chat/completions} responses filled with lorem text.
 *
 * <p>Honours {@code max_tokens}: when present the reply is exactly that long and finishes with {@code length};
 * otherwise a random length between 10 and the configured default is used and the reply finishes with
 * {@code stop}.</p>
 *
 * @since 0.1.0
 */
public final class OpenAiChatCompletionGenerator extends AbstractOpenAiGenerator {
  static final int MIN_COMPLETION_TOKENS = 10;

  private final GenerationConfig generation;

  public OpenAiChatCompletionGenerator(
      GenerationConfig generation, JsonSupport json, Random random, Clock clock) {
    super(OpenAiRoute.Operation.CHAT_COMPLETIONS, json, random, clock);
    this.generation = generation;
  }

  @Override
  protected Generated respond(RequestContext context, DeploymentConfig deployment, Map<String, Object> body) {
    if (!(body.get("messages") instanceof List<?> messages) || messages.isEmpty()) {
      throw new IllegalArgumentException("messages must be a non-empty array");
    }
    long promptTokens = TokenEstimator.estimateChat(messages);
    CompletionLength length = CompletionLength.choose(body, generation, random);
    String content = LoremText.generate(random, length.tokens());

    Map<String, Object> message = new LinkedHashMap<>();
    message.put("role", "assistant");
    message.put("content", content);
    Map<String, Object> choice = new LinkedHashMap<>();
    choice.put("index", 0);
    choice.put("message", message);
    choice.put("finish_reason", length.finishReason());

    Map<String, Object> response = new LinkedHashMap<>();
    response.put("id", randomId("chatcmpl-"));
    response.put("object", "chat.completion");
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
