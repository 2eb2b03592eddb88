package ca.gc.cra.aoaisim.infrastructure.generate;

import ca.gc.cra.aoaisim.config.GenerationConfig;
import java.util.Map;
import java.util.Random;

/** Completion size picked for a generated reply. */
record CompletionLength(int tokens, String finishReason) {

  static CompletionLength choose(Map<String, Object> body, GenerationConfig generation, Random random) {
    int requested = AbstractOpenAiGenerator.intField(body, "max_tokens", 0);
    if (requested > 0) {
      return new CompletionLength(requested, "length");
    }
    int min = OpenAiChatCompletionGenerator.MIN_COMPLETION_TOKENS;
    int max = Math.max(min, generation.defaultMaxTokens());
    return new CompletionLength(min + random.nextInt(max - min + 1), "stop");
  }
}
