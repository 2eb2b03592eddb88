package ca.gc.cra.aoaisim.infrastructure.recording;

import ca.gc.cra.aoaisim.application.port.ForwardedExchange;
import ca.gc.cra.aoaisim.application.port.RecordReplayPort;
import ca.gc.cra.aoaisim.application.port.RecordingStore;
import ca.gc.cra.aoaisim.application.port.UpstreamForwarder;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.SimulatorMode;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import ca.gc.cra.aoaisim.domain.recording.ExchangeFacts;
import ca.gc.cra.aoaisim.domain.recording.RecordedExchange;
import ca.gc.cra.aoaisim.domain.recording.RequestFingerprint;
import ca.gc.cra.aoaisim.infrastructure.generate.OpenAiRoute;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Record and replay producer behind the mode dispatcher.
 * <p><strong>Record mode:</strong> forwards each request to the first matching {@link UpstreamForwarder}, returns
 * the real response and buffers the exchange per request path. With autosave on, a new exchange schedules a
 * save unless one is already waiting for the writer. A recording session always starts empty; saving replaces the file for each path that changed.</p>
 * <p><strong>Replay mode:</strong> answers from recordings loaded by {@link #open()}, matched on method, path,
 * query and body. The recorded duration becomes the latency hint and the recorded limiter, deployment and token
 * count are restored onto the request context. A miss yields no response.</p>
 * <p><strong>Thread-safety:</strong> Buffers are guarded by a single lock; writes run on a dedicated
 * single-thread executor so saves never overlap.</p>
 *
 * @since 0.1.0
 */
public final class RecordReplayHandler implements RecordReplayPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RecordReplayHandler.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;
  private static final String CONTENT_TYPE = "content-type";

  private final SimulatorMode mode;
  private final boolean autosave;
  private final RecordingStore store;
  private final List<UpstreamForwarder> forwarders;
  private final ExecutorService writer;

  private final Object lock = new Object();
  private final Map<String, List<RecordedExchange>> recordings = new LinkedHashMap<>();
  private final Map<String, Long> versions = new HashMap<>();
  private final Map<String, Long> savedVersions = new HashMap<>();
  private final AtomicBoolean autosaveQueued = new AtomicBoolean();
  private volatile Map<RequestFingerprint, RecordedExchange> replayIndex = Map.of();

  /**
   * Creates a handler.
   *
   * @param mode active simulator mode; the handler is inert in generate mode
   * @param autosave whether record mode saves after every new exchange
   * @param store recording persistence
   * @param forwarders upstream forwarders, evaluated in order
   * @param writer single-thread executor used for saves
   */
  public RecordReplayHandler(
      SimulatorMode mode,
      boolean autosave,
      RecordingStore store,
      List<UpstreamForwarder> forwarders,
      ExecutorService writer) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.autosave = autosave;
    this.store = Objects.requireNonNull(store, "store");
    this.forwarders = List.copyOf(forwarders);
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  /**
   * Loads recordings when replaying.
   *
   * @throws IOException when the recording files cannot be read
   */
  public void open() throws IOException {
    if (mode != SimulatorMode.REPLAY) {
      return;
    }
    Map<RequestFingerprint, RecordedExchange> index = new HashMap<>();
    List<RecordedExchange> loaded = store.loadAll();
    for (RecordedExchange exchange : loaded) {
      index.put(exchange.fingerprint(), exchange);
    }
    replayIndex = Map.copyOf(index);
    log.info("Loaded {} recordings ({} distinct requests) for replay", loaded.size(), index.size());
  }

  @Override
  public CompletionStage<Optional<SimulatorResponse>> handle(RequestContext context) {
    return switch (mode) {
      case RECORD -> record(context);
      case REPLAY -> CompletableFuture.completedFuture(replay(context));
      case GENERATE -> CompletableFuture.completedFuture(Optional.empty());
    };
  }

  private Optional<SimulatorResponse> replay(RequestContext context) {
    SimulatorRequest request = context.request();
    RecordedExchange exchange = replayIndex.get(RequestFingerprint.of(request));
    if (exchange == null) {
      log.warn("No recording found for {} {}", request.method(), request.pathAndQuery());
      return Optional.empty();
    }
    ExchangeFacts facts = exchange.facts();
    facts.limiter().ifPresent(context::setLimiterKey);
    facts.deployment().ifPresent(context::setDeploymentName);
    facts.tokens().ifPresent(context::setTokenCount);
    context.setRecordedDurationMs(exchange.durationMs());
    return Optional.of(exchange.response());
  }

  private CompletionStage<Optional<SimulatorResponse>> record(RequestContext context) {
    SimulatorRequest request = context.request();
    Optional<UpstreamForwarder> forwarder = forwarders.stream().filter(f -> f.matches(request)).findFirst();
    if (forwarder.isEmpty()) {
      log.warn("No forwarder configured for {} {}", request.method(), request.path());
      return CompletableFuture.completedFuture(Optional.empty());
    }
    return forwarder.get().forward(request).thenApply(forwarded -> {
      String deployment = OpenAiRoute.parse(request.path()).map(OpenAiRoute::deployment).orElse(null);
      if (forwarded.limiterKey() != null) {
        context.setLimiterKey(forwarded.limiterKey());
      }
      if (deployment != null) {
        context.setDeploymentName(deployment);
      }
      forwarded.tokenCount().ifPresent(context::setTokenCount);
      buffer(request, forwarded, deployment);
      return Optional.of(forwarded.response());
    });
  }

  private void buffer(SimulatorRequest request, ForwardedExchange forwarded, String deployment) {
    Map<String, String> headers = new LinkedHashMap<>();
    request.header(CONTENT_TYPE).ifPresent(value -> headers.put(CONTENT_TYPE, value));
    Long tokens = forwarded.tokenCount().isPresent() ? forwarded.tokenCount().getAsLong() : null;
    RecordedExchange exchange = new RecordedExchange(
        request.method(),
        request.pathAndQuery(),
        headers,
        request.body(),
        forwarded.response(),
        forwarded.durationMs(),
        new ExchangeFacts(forwarded.limiterKey(), deployment, tokens));
    synchronized (lock) {
      recordings.computeIfAbsent(request.path(), p -> new ArrayList<>()).add(exchange);
      versions.merge(request.path(), 1L, Long::sum);
    }
    if (autosave) {
      scheduleAutosave();
    }
  }

  // One autosave at most waits in the writer queue; it picks up every exchange buffered before it starts.
  private void scheduleAutosave() {
    if (!autosaveQueued.compareAndSet(false, true)) {
      return;
    }
    try {
      CompletableFuture.runAsync(() -> {
        autosaveQueued.set(false);
        writeDirty();
      }, writer).whenComplete((ignored, ex) -> {
        if (ex != null) {
          log.warn("Autosave of recordings failed", ex);
        }
      });
    } catch (RejectedExecutionException ex) {
      autosaveQueued.set(false);
      log.warn("Autosave of recordings rejected; writer is shut down", ex);
    }
  }

  @Override
  public CompletionStage<Void> save() {
    if (mode != SimulatorMode.RECORD) {
      return CompletableFuture.completedFuture(null);
    }
    try {
      return CompletableFuture.runAsync(this::writeDirty, writer);
    } catch (RejectedExecutionException ex) {
      return CompletableFuture.failedFuture(ex);
    }
  }

  private void writeDirty() {
    Map<String, List<RecordedExchange>> pending = new LinkedHashMap<>();
    Map<String, Long> pendingVersions = new HashMap<>();
    synchronized (lock) {
      for (Map.Entry<String, List<RecordedExchange>> entry : recordings.entrySet()) {
        String path = entry.getKey();
        long version = versions.getOrDefault(path, 0L);
        if (version != savedVersions.getOrDefault(path, 0L)) {
          pending.put(path, List.copyOf(entry.getValue()));
          pendingVersions.put(path, version);
        }
      }
    }
    for (Map.Entry<String, List<RecordedExchange>> entry : pending.entrySet()) {
      try {
        store.write(entry.getKey(), entry.getValue());
      } catch (IOException ex) {
        throw new UncheckedIOException("Failed to write recordings for " + entry.getKey(), ex);
      }
      synchronized (lock) {
        savedVersions.put(entry.getKey(), pendingVersions.get(entry.getKey()));
      }
    }
    if (!pending.isEmpty()) {
      log.info("Saved recordings for {} path(s)", pending.size());
    }
  }

  /** @return number of exchanges buffered in record mode */
  public int bufferedCount() {
    synchronized (lock) {
      return recordings.values().stream().mapToInt(List::size).sum();
    }
  }

  /** @return number of distinct requests available for replay */
  public int replayableCount() {
    return replayIndex.size();
  }

  /** Saves outstanding recordings and stops the writer. */
  @Override
  public void close() {
    if (mode == SimulatorMode.RECORD) {
      try {
        save().toCompletableFuture().get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while saving recordings on shutdown");
      } catch (Exception ex) {
        log.error("Failed to save recordings on shutdown", ex);
      }
    }
    writer.shutdown();
    try {
      if (!writer.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        writer.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      writer.shutdownNow();
    }
  }
}
