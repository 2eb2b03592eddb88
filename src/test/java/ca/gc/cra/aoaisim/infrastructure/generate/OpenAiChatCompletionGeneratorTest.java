package ca.gc.cra.aoaisim.infrastructure.generate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.LimiterKeys;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.GenerationConfig;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;
import org.junit.jupiter.api.Test;

class OpenAiChatCompletionGeneratorTest {
  private static final String PATH = "/openai/deployments/gpt-4o/chat/completions?api-version=2024-02-01";
  private static final String BODY =
      "{\"messages\":[{\"role\":\"user\",\"content\":\"Hello there\"}],\"max_tokens\":20}";

  private final JsonSupport json = new JsonSupport();
  private final OpenAiChatCompletionGenerator generator = new OpenAiChatCompletionGenerator(
      GenerateFixtures.config().generation(), json, new Random(42), GenerateFixtures.CLOCK);

  @Test
  @SuppressWarnings("unchecked")
  void producesChatCompletionWithUsage() {
    RequestContext context = GenerateFixtures.context("POST", PATH, BODY);

    SimulatorResponse response = generate(context).orElseThrow();

    assertEquals(200, response.status());
    Map<String, Object> body = json.parseObject(response.bodyText());
    assertEquals("chat.completion", body.get("object"));
    assertTrue(((String) body.get("id")).startsWith("chatcmpl-"));
    assertEquals(GenerateFixtures.NOW.getEpochSecond(), ((Number) body.get("created")).longValue());
    assertEquals("gpt-4o-2024-05-13", body.get("model"));

    Map<String, Object> choice = ((List<Map<String, Object>>) body.get("choices")).get(0);
    assertEquals("length", choice.get("finish_reason"));
    Map<String, Object> message = (Map<String, Object>) choice.get("message");
    assertEquals("assistant", message.get("role"));
    assertEquals(80, ((String) message.get("content")).length());

    Map<String, Object> usage = (Map<String, Object>) body.get("usage");
    assertEquals(10L, ((Number) usage.get("prompt_tokens")).longValue());
    assertEquals(20L, ((Number) usage.get("completion_tokens")).longValue());
    assertEquals(30L, ((Number) usage.get("total_tokens")).longValue());
  }

  @Test
  void populatesRequestContext() {
    RequestContext context = GenerateFixtures.context("POST", PATH, BODY);

    generate(context);

    assertEquals(Optional.of("gpt-4o"), context.deploymentName());
    assertEquals(Optional.of(LimiterKeys.OPENAI), context.limiterKey());
    assertEquals(OptionalLong.of(30), context.tokenCount());
    assertEquals(OptionalLong.of(100), context.recordedDurationMs());
  }

  @Test
  @SuppressWarnings("unchecked")
  void withoutMaxTokensStopsWithinDefaultRange() {
    GenerationConfig generation = new GenerationConfig(40, 0, 0, OptionalLong.empty());
    OpenAiChatCompletionGenerator small =
        new OpenAiChatCompletionGenerator(generation, json, new Random(7), GenerateFixtures.CLOCK);
    RequestContext context = GenerateFixtures.context(
        "POST", PATH, "{\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}");

    SimulatorResponse response = small.generate(context).toCompletableFuture().join().orElseThrow();

    Map<String, Object> body = json.parseObject(response.bodyText());
    Map<String, Object> choice = ((List<Map<String, Object>>) body.get("choices")).get(0);
    assertEquals("stop", choice.get("finish_reason"));
    long completion = ((Number) ((Map<String, Object>) body.get("usage")).get("completion_tokens")).longValue();
    assertTrue(completion >= 10 && completion <= 40, "completion tokens " + completion);
    assertTrue(context.recordedDurationMs().isEmpty());
  }

  @Test
  void unconfiguredDeploymentUsesItsNameAsModel() {
    RequestContext context =
        GenerateFixtures.context("POST", "/openai/deployments/unknown/chat/completions", BODY);

    SimulatorResponse response = generate(context).orElseThrow();

    assertEquals("unknown", json.parseObject(response.bodyText()).get("model"));
    assertEquals(Optional.of("unknown"), context.deploymentName());
  }

  @Test
  void malformedBodyIsBadRequest() {
    RequestContext context = GenerateFixtures.context("POST", PATH, "{not json");

    SimulatorResponse response = generate(context).orElseThrow();

    assertEquals(400, response.status());
    assertTrue(response.bodyText().contains("BadRequest"));
    assertTrue(context.tokenCount().isEmpty());
  }

  @Test
  void missingMessagesIsBadRequest() {
    assertEquals(400, generate(GenerateFixtures.context("POST", PATH, "{\"messages\":[]}")).orElseThrow().status());
    assertEquals(400, generate(GenerateFixtures.context(
        "POST", PATH, "{\"messages\":[{\"role\":\"user\",\"content\":\"x\"}],\"max_tokens\":0}"))
        .orElseThrow().status());
  }

  @Test
  void ignoresOtherOperationsAndMethods() {
    assertTrue(generate(GenerateFixtures.context("GET", PATH, null)).isEmpty());
    assertTrue(generate(GenerateFixtures.context(
        "POST", "/openai/deployments/gpt-4o/embeddings", "{\"input\":\"x\"}")).isEmpty());
    assertTrue(generate(GenerateFixtures.context("POST", "/other", BODY)).isEmpty());
  }

  private Optional<SimulatorResponse> generate(RequestContext context) {
    return generator.generate(context).toCompletableFuture().join();
  }
}
