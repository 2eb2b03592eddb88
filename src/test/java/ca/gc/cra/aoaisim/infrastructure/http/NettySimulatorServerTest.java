package ca.gc.cra.aoaisim.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoaisim.config.ServerConfig;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NettySimulatorServerTest {
  private EventLoopGroup workers;
  private NettySimulatorServer server;
  private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
  private final AtomicReference<SimulatorRequest> seen = new AtomicReference<>();

  @BeforeEach
  void setUp() {
    workers = new NioEventLoopGroup(1);
  }

  @AfterEach
  void tearDown() {
    if (server != null) {
      server.close();
    }
    workers.shutdownGracefully().syncUninterruptibly();
  }

  @Test
  void boundPortIsUnknownBeforeStart() {
    server = new NettySimulatorServer(config(), workers, this::echo);

    assertEquals(-1, server.boundPort());
  }

  @Test
  void convertsRequestAndWritesResponse() throws Exception {
    start(this::echo);

    HttpResponse<String> response = client.send(
        HttpRequest.newBuilder(uri("/openai/deployments/gpt-4o/embeddings?api-version=2024-02-01"))
            .header("api-key", "secret")
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString("{\"input\":\"hi\"}"))
            .build(),
        HttpResponse.BodyHandlers.ofString());

    assertEquals(201, response.statusCode());
    assertEquals("{\"echo\":true}", response.body());
    assertEquals("yes", response.headers().firstValue("x-simulated").orElseThrow());
    SimulatorRequest request = seen.get();
    assertEquals("POST", request.method());
    assertEquals("/openai/deployments/gpt-4o/embeddings", request.path());
    assertEquals("api-version=2024-02-01", request.query());
    assertEquals("secret", request.header("API-KEY").orElseThrow());
    assertEquals("{\"input\":\"hi\"}", request.bodyText());
  }

  @Test
  void asyncResponsesAreWrittenWhenReady() throws Exception {
    CompletableFuture<SimulatorResponse> pending = new CompletableFuture<>();
    start(request -> pending);

    CompletableFuture<HttpResponse<String>> call = client.sendAsync(
        HttpRequest.newBuilder(uri("/slow")).GET().build(), HttpResponse.BodyHandlers.ofString());
    pending.complete(SimulatorResponse.text(200, "done"));

    assertEquals("done", call.get().body());
  }

  @Test
  void failedStageBecomesEmpty500() throws Exception {
    start(request -> CompletableFuture.failedFuture(new IllegalStateException("boom")));

    HttpResponse<String> response = get("/fail");

    assertEquals(500, response.statusCode());
    assertTrue(response.body().isEmpty());
  }

  @Test
  void throwingHandlerBecomesEmpty500() throws Exception {
    start(request -> {
      throw new IllegalStateException("boom");
    });

    assertEquals(500, get("/throw").statusCode());
  }

  @Test
  void connectionIsReusedAcrossRequests() throws Exception {
    start(this::echo);

    assertEquals(201, get("/one").statusCode());
    assertEquals(201, get("/two").statusCode());
    assertEquals("/two", seen.get().path());
  }

  private CompletionStage<SimulatorResponse> echo(SimulatorRequest request) {
    seen.set(request);
    return CompletableFuture.completedFuture(
        SimulatorResponse.json(201, "{\"echo\":true}").withHeaders(Map.of("x-simulated", "yes")));
  }

  private void start(Function<SimulatorRequest, CompletionStage<SimulatorResponse>> handler)
      throws InterruptedException {
    server = new NettySimulatorServer(config(), workers, handler);
    server.start();
  }

  private HttpResponse<String> get(String path) throws IOException, InterruptedException {
    return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
  }

  private URI uri(String pathAndQuery) {
    return URI.create("http://127.0.0.1:" + server.boundPort() + pathAndQuery);
  }

  private static ServerConfig config() {
    return new ServerConfig("127.0.0.1", 0, 1, 64 * 1024);
  }
}
