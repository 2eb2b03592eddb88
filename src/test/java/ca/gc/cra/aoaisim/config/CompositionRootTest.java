package ca.gc.cra.aoaisim.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoaisim.application.port.ClockPort;
import ca.gc.cra.aoaisim.infrastructure.telemetry.OpenTelemetryBootstrap;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  private static final String CHAT_PATH =
      "/openai/deployments/gpt-4o/chat/completions?api-version=2024-02-01";
  private static final String CHAT_BODY =
      "{\"messages\":[{\"role\":\"user\",\"content\":\"hello\"}],\"max_tokens\":10}";

  @TempDir Path tempDir;

  private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
  private CompositionRoot root;

  @AfterEach
  void tearDown() {
    if (root != null) {
      root.close();
    }
  }

  @Test
  void servesGeneratedChatCompletionThenThrottles() throws Exception {
    start(1_000);

    HttpResponse<String> first = post(CHAT_PATH, CHAT_BODY, "test-key");
    assertEquals(200, first.statusCode());
    assertTrue(first.body().contains("\"chat.completion\""), first.body());
    assertEquals("0", first.headers().firstValue("x-ratelimit-remaining-requests").orElseThrow());

    HttpResponse<String> second = post(CHAT_PATH, CHAT_BODY, "test-key");
    assertEquals(429, second.statusCode());
    assertTrue(second.headers().firstValue("Retry-After").isPresent());
  }

  @Test
  void rejectsWrongKeyOverTheWire() throws Exception {
    start(100_000);

    HttpResponse<String> response = post(CHAT_PATH, CHAT_BODY, "wrong");

    assertEquals(401, response.statusCode());
    assertEquals("{\"detail\":\"Missing or incorrect API Key\"}", response.body());
  }

  @Test
  void livenessAndConfigEndpointsAreServed() throws Exception {
    start(100_000);

    HttpResponse<String> liveness = client.send(
        HttpRequest.newBuilder(uri("/")).GET().build(), HttpResponse.BodyHandlers.ofString());
    assertEquals(200, liveness.statusCode());

    HttpResponse<String> view = client.send(
        HttpRequest.newBuilder(uri("/++/config")).header("api-key", "test-key").GET().build(),
        HttpResponse.BodyHandlers.ofString());
    assertEquals(200, view.statusCode());
    assertTrue(view.body().contains("\"gpt-4o\""), view.body());
    assertFalse(view.body().contains("test-key"), view.body());
  }

  @Test
  void closeIsIdempotent() throws Exception {
    start(100_000);

    root.close();
    root.close();
    assertEquals(-1, root.server().boundPort());
  }

  private void start(long tokensPerMinute) throws Exception {
    Map<String, String> kv = new LinkedHashMap<>();
    kv.put("apiKey", "test-key");
    kv.put("server.host", "127.0.0.1");
    kv.put("server.port", "0");
    kv.put("recording.dir", tempDir.toString());
    kv.put("openai.deployments.gpt-4o.tokensPerMinute", Long.toString(tokensPerMinute));
    kv.put("generation.seed", "7");
    SimulatorConfig config = SimulatorConfig.fromMap(kv);
    root = new CompositionRoot(
        config,
        OpenTelemetryBootstrap.BootstrapResult.noop(),
        ClockPort.SYSTEM,
        Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
    root.start();
  }

  private HttpResponse<String> post(String path, String body, String key) throws Exception {
    return client.send(
        HttpRequest.newBuilder(uri(path))
            .header("api-key", key)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build(),
        HttpResponse.BodyHandlers.ofString());
  }

  private URI uri(String path) {
    return URI.create("http://127.0.0.1:" + root.server().boundPort() + path);
  }
}
