package ca.gc.cra.aoaisim.infrastructure.recording;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoaisim.application.port.ForwardedExchange;
import ca.gc.cra.aoaisim.application.port.RecordingStore;
import ca.gc.cra.aoaisim.application.port.RequestTrace;
import ca.gc.cra.aoaisim.application.port.UpstreamForwarder;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.SimulatorConfig;
import ca.gc.cra.aoaisim.config.SimulatorMode;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import ca.gc.cra.aoaisim.domain.recording.ExchangeFacts;
import ca.gc.cra.aoaisim.domain.recording.RecordedExchange;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecordReplayHandlerTest {
  private static final String CHAT_PATH = "/openai/deployments/gpt-4o/chat/completions";
  private static final String CHAT_BODY = "{\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}";

  @TempDir
  Path tempDir;

  private final List<RecordReplayHandler> handlers = new ArrayList<>();

  @AfterEach
  void tearDown() {
    handlers.forEach(RecordReplayHandler::close);
  }

  @Test
  void recordForwardsAndPopulatesContext() {
    FakeForwarder forwarder = new FakeForwarder("/openai/", 37);
    RecordReplayHandler handler = handler(SimulatorMode.RECORD, false, new InMemoryStore(), List.of(forwarder));
    RequestContext context = context(SimulatorMode.RECORD, post(CHAT_PATH, CHAT_BODY));

    Optional<SimulatorResponse> response = handler.handle(context).toCompletableFuture().join();

    assertEquals(200, response.orElseThrow().status());
    assertEquals(1, forwarder.calls.get());
    assertEquals(Optional.of("openai"), context.limiterKey());
    assertEquals(Optional.of("gpt-4o"), context.deploymentName());
    assertEquals(OptionalLong.of(37), context.tokenCount());
    assertTrue(context.recordedDurationMs().isEmpty());
    assertEquals(1, handler.bufferedCount());
  }

  @Test
  void recordWithoutMatchingForwarderProducesNothing() {
    RecordReplayHandler handler = handler(
        SimulatorMode.RECORD, false, new InMemoryStore(), List.of(new FakeForwarder("/formrecognizer/", 0)));

    Optional<SimulatorResponse> response =
        handler.handle(context(SimulatorMode.RECORD, post(CHAT_PATH, CHAT_BODY))).toCompletableFuture().join();

    assertTrue(response.isEmpty());
    assertEquals(0, handler.bufferedCount());
  }

  @Test
  void saveWritesOnlyChangedPaths() {
    InMemoryStore store = new InMemoryStore();
    RecordReplayHandler handler =
        handler(SimulatorMode.RECORD, false, store, List.of(new FakeForwarder("/openai/", 5)));
    handler.handle(context(SimulatorMode.RECORD, post(CHAT_PATH, CHAT_BODY))).toCompletableFuture().join();

    handler.save().toCompletableFuture().join();
    handler.save().toCompletableFuture().join();

    assertEquals(1, store.writes.get());
    RecordedExchange saved = store.files.get(CHAT_PATH).get(0);
    assertEquals(Map.of("content-type", "application/json"), saved.requestHeaders());
    assertEquals(new ExchangeFacts("openai", "gpt-4o", 5L), saved.facts());
    assertEquals(120, saved.durationMs());
  }

  @Test
  void autosavePersistsEachExchange() {
    InMemoryStore store = new InMemoryStore();
    RecordReplayHandler handler =
        handler(SimulatorMode.RECORD, true, store, List.of(new FakeForwarder("/openai/", 5)));

    handler.handle(context(SimulatorMode.RECORD, post(CHAT_PATH, CHAT_BODY))).toCompletableFuture().join();
    handler.handle(context(SimulatorMode.RECORD, post(CHAT_PATH, "{\"x\":1}"))).toCompletableFuture().join();
    handler.save().toCompletableFuture().join();

    assertEquals(2, store.files.get(CHAT_PATH).size());
  }

  @Test
  void autosavesQueuedBehindABusyWriterCollapseIntoOne() throws InterruptedException {
    InMemoryStore store = new InMemoryStore();
    ThreadPoolExecutor writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>());
    RecordReplayHandler handler =
        handler(SimulatorMode.RECORD, true, store, List.of(new FakeForwarder("/openai/", 5)), writer);
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch busy = new CountDownLatch(1);
    writer.execute(() -> {
      busy.countDown();
      try {
        release.await();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    assertTrue(busy.await(5, TimeUnit.SECONDS));

    for (int i = 0; i < 3; i++) {
      handler.handle(context(SimulatorMode.RECORD, post(CHAT_PATH, "{\"n\":" + i + "}")))
          .toCompletableFuture().join();
    }
    int queued = writer.getQueue().size();
    release.countDown();
    handler.save().toCompletableFuture().join();

    assertEquals(1, queued);
    assertEquals(1, store.writes.get());
    assertEquals(3, store.files.get(CHAT_PATH).size());
  }

  @Test
  void saveOutsideRecordModeWritesNothing() {
    InMemoryStore store = new InMemoryStore();
    RecordReplayHandler handler = handler(SimulatorMode.REPLAY, true, store, List.of());

    handler.save().toCompletableFuture().join();

    assertEquals(0, store.writes.get());
  }

  @Test
  void replayReturnsRecordedResponseAndFacts() throws IOException {
    InMemoryStore store = new InMemoryStore();
    store.files.put(CHAT_PATH, List.of(recorded(CHAT_BODY, "{\"n\":1}", 300)));
    RecordReplayHandler handler = handler(SimulatorMode.REPLAY, false, store, List.of());
    handler.open();
    RequestContext context = context(SimulatorMode.REPLAY, post(CHAT_PATH, CHAT_BODY));

    SimulatorResponse response = handler.handle(context).toCompletableFuture().join().orElseThrow();

    assertEquals("{\"n\":1}", response.bodyText());
    assertEquals(Optional.of("openai"), context.limiterKey());
    assertEquals(Optional.of("gpt-4o"), context.deploymentName());
    assertEquals(OptionalLong.of(9), context.tokenCount());
    assertEquals(OptionalLong.of(300), context.recordedDurationMs());
  }

  @Test
  void replayMatchesOnExactBodyAndLastDuplicateWins() throws IOException {
    InMemoryStore store = new InMemoryStore();
    store.files.put(CHAT_PATH, List.of(
        recorded(CHAT_BODY, "{\"n\":1}", 10),
        recorded(CHAT_BODY, "{\"n\":2}", 10)));
    RecordReplayHandler handler = handler(SimulatorMode.REPLAY, false, store, List.of());
    handler.open();

    Optional<SimulatorResponse> hit =
        handler.handle(context(SimulatorMode.REPLAY, post(CHAT_PATH, CHAT_BODY))).toCompletableFuture().join();
    Optional<SimulatorResponse> miss = handler.handle(
        context(SimulatorMode.REPLAY, post(CHAT_PATH, CHAT_BODY + " "))).toCompletableFuture().join();

    assertEquals(1, handler.replayableCount());
    assertEquals("{\"n\":2}", hit.orElseThrow().bodyText());
    assertTrue(miss.isEmpty());
  }

  @Test
  void recordedSessionReplaysFromDisk() throws IOException {
    YamlRecordingStore store = new YamlRecordingStore(tempDir);
    RecordReplayHandler recorder =
        handler(SimulatorMode.RECORD, false, store, List.of(new FakeForwarder("/openai/", 21)));
    recorder.handle(context(SimulatorMode.RECORD, post(CHAT_PATH, CHAT_BODY))).toCompletableFuture().join();
    recorder.save().toCompletableFuture().join();

    RecordReplayHandler replayer = handler(SimulatorMode.REPLAY, false, store, List.of());
    replayer.open();
    RequestContext context = context(SimulatorMode.REPLAY, post(CHAT_PATH, CHAT_BODY));
    SimulatorResponse response = replayer.handle(context).toCompletableFuture().join().orElseThrow();

    assertEquals(FakeForwarder.UPSTREAM_BODY, response.bodyText());
    assertEquals(OptionalLong.of(21), context.tokenCount());
    assertEquals(OptionalLong.of(120), context.recordedDurationMs());
  }

  private RecordReplayHandler handler(
      SimulatorMode mode, boolean autosave, RecordingStore store, List<UpstreamForwarder> forwarders) {
    return handler(mode, autosave, store, forwarders, Executors.newSingleThreadExecutor());
  }

  private RecordReplayHandler handler(
      SimulatorMode mode,
      boolean autosave,
      RecordingStore store,
      List<UpstreamForwarder> forwarders,
      ExecutorService writer) {
    RecordReplayHandler handler = new RecordReplayHandler(mode, autosave, store, forwarders, writer);
    handlers.add(handler);
    return handler;
  }

  private static RequestContext context(SimulatorMode mode, SimulatorRequest request) {
    SimulatorConfig config = SimulatorConfig.fromMap(Map.of("apiKey", "k", "mode", mode.label()));
    return new RequestContext(config, request, RequestTrace.NO_OP, 0L);
  }

  private static SimulatorRequest post(String path, String body) {
    Map<String, List<String>> headers = new LinkedHashMap<>();
    headers.put("Content-Type", List.of("application/json"));
    headers.put("api-key", List.of("client-key"));
    headers.put("User-Agent", List.of("test"));
    return SimulatorRequest.of("POST", path, headers, body.getBytes(StandardCharsets.UTF_8));
  }

  private static RecordedExchange recorded(String requestBody, String responseBody, long durationMs) {
    return new RecordedExchange(
        "POST",
        CHAT_PATH,
        Map.of(),
        requestBody.getBytes(StandardCharsets.UTF_8),
        SimulatorResponse.json(200, responseBody),
        durationMs,
        new ExchangeFacts("openai", "gpt-4o", 9L));
  }

  private static final class FakeForwarder implements UpstreamForwarder {
    static final String UPSTREAM_BODY = "{\"id\":\"chatcmpl-upstream\"}";

    private final String prefix;
    private final long tokens;
    private final AtomicInteger calls = new AtomicInteger();

    FakeForwarder(String prefix, long tokens) {
      this.prefix = prefix;
      this.tokens = tokens;
    }

    @Override
    public boolean matches(SimulatorRequest request) {
      return request.path().startsWith(prefix);
    }

    @Override
    public CompletionStage<ForwardedExchange> forward(SimulatorRequest request) {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture(new ForwardedExchange(
          SimulatorResponse.json(200, UPSTREAM_BODY), 120, "openai", OptionalLong.of(tokens)));
    }
  }

  private static final class InMemoryStore implements RecordingStore {
    private final Map<String, List<RecordedExchange>> files = new LinkedHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public synchronized List<RecordedExchange> loadAll() {
      List<RecordedExchange> all = new ArrayList<>();
      files.values().forEach(all::addAll);
      return all;
    }

    @Override
    public synchronized void write(String path, List<RecordedExchange> exchanges) {
      writes.incrementAndGet();
      files.put(path, List.copyOf(exchanges));
    }
  }
}
