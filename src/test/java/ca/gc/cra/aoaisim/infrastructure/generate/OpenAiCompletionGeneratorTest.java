package ca.gc.cra.aoaisim.infrastructure.generate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Random;
import org.junit.jupiter.api.Test;

class OpenAiCompletionGeneratorTest {
  private static final String PATH = "/openai/deployments/gpt-4o/completions";

  private final JsonSupport json = new JsonSupport();
  private final OpenAiCompletionGenerator generator = new OpenAiCompletionGenerator(
      GenerateFixtures.config().generation(), json, new Random(11), GenerateFixtures.CLOCK);

  @Test
  @SuppressWarnings("unchecked")
  void producesTextCompletion() {
    RequestContext context =
        GenerateFixtures.context("POST", PATH, "{\"prompt\":[\"Once upon\",\"a time\"],\"max_tokens\":12}");

    SimulatorResponse response = generator.generate(context).toCompletableFuture().join().orElseThrow();

    Map<String, Object> body = json.parseObject(response.bodyText());
    assertEquals("text_completion", body.get("object"));
    assertTrue(((String) body.get("id")).startsWith("cmpl-"));
    Map<String, Object> choice = ((List<Map<String, Object>>) body.get("choices")).get(0);
    assertEquals(48, ((String) choice.get("text")).length());
    assertEquals("length", choice.get("finish_reason"));
    assertTrue(choice.containsKey("logprobs"));
    assertNull(choice.get("logprobs"));
    // "Once upon" = 3 tokens, "a time" = 2 tokens
    assertEquals(OptionalLong.of(5 + 12), context.tokenCount());
    assertEquals(OptionalLong.of(60), context.recordedDurationMs());
  }

  @Test
  void nonStringPromptIsBadRequest() {
    RequestContext context = GenerateFixtures.context("POST", PATH, "{\"prompt\":[\"ok\",7]}");

    assertEquals(400, generator.generate(context).toCompletableFuture().join().orElseThrow().status());
  }

  @Test
  void chatPathIsNotACompletion() {
    RequestContext context =
        GenerateFixtures.context("POST", "/openai/deployments/gpt-4o/chat/completions", "{\"prompt\":\"x\"}");

    assertTrue(generator.generate(context).toCompletableFuture().join().isEmpty());
  }
}
