package ca.gc.cra.aoaisim.application.pipeline;

import ca.gc.cra.aoaisim.application.port.ClockPort;
import ca.gc.cra.aoaisim.application.port.RequestTrace;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.SimulatorConfig;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Orchestrates one simulated request from authentication to the final response.
 * <p><strong>Why:</strong> Fixes the stage order so admission is decided before latency is added and metrics see
 * the final outcome.</p>
 * <p><strong>Role:</strong> Application-layer use case behind the catch-all HTTP route.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Authenticate; a failure returns 401 before a context exists.</li>
 *   <li>Create the {@link RequestContext} and start the latency clock.</li>
 *   <li>Dispatch to the active producer; an empty result returns 500 with no metrics.</li>
 *   <li>Resolve the limiter, emulate latency, record metrics.</li>
 *   <li>Convert any exception into a 500 without exposing it to the client.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless per call; safe for concurrent requests.</p>
 * <p><strong>Observability:</strong> Dispatch faults and internal faults are logged at ERROR.</p>
 *
 * @since 0.1.0
 */
public final class RequestPipeline {
  private static final Logger log = LoggerFactory.getLogger(RequestPipeline.class);

  private final SimulatorConfig config;
  private final CredentialValidator credentials;
  private final ModeDispatcher dispatcher;
  private final LimiterRegistry limiters;
  private final LatencyEmulator latency;
  private final MetricsRecorder metrics;
  private final ClockPort clock;

  /**
   * Creates a pipeline from its stages.
   *
   * @param config effective configuration
   * @param credentials authentication stage
   * @param dispatcher mode dispatch stage
   * @param limiters limiter stage
   * @param latency latency emulation stage
   * @param metrics metrics stage
   * @param clock monotonic clock shared with the latency and metrics stages
   */
  public RequestPipeline(
      SimulatorConfig config,
      CredentialValidator credentials,
      ModeDispatcher dispatcher,
      LimiterRegistry limiters,
      LatencyEmulator latency,
      MetricsRecorder metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.limiters = Objects.requireNonNull(limiters, "limiters");
    this.latency = Objects.requireNonNull(latency, "latency");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Processes a request.
   *
   * @param request inbound request
   * @param trace span covering the request
   * @return stage that always completes normally with the response to send
   */
  public CompletionStage<SimulatorResponse> handle(SimulatorRequest request, RequestTrace trace) {
    Objects.requireNonNull(request, "request");
    StageResult<CredentialCarrier> auth = credentials.validate(request);
    if (auth instanceof StageResult.Failed<CredentialCarrier> failed) {
      return CompletableFuture.completedFuture(failed.fault().toResponse());
    }

    RequestContext context = new RequestContext(config, request, trace, clock.nanoTime());
    AtomicReference<String> stage = new AtomicReference<>("dispatch");

    return CompletableFuture.completedFuture(context)
        .thenCompose(dispatcher::dispatch)
        .thenCompose(dispatched -> {
          if (dispatched instanceof StageResult.Failed<SimulatorResponse> failed) {
            log.error("No response generated for request: {}", request.path());
            return CompletableFuture.completedFuture(failed.fault().toResponse());
          }
          if (!(dispatched instanceof StageResult.Ok<SimulatorResponse> ok)) {
            throw new IllegalStateException("Unknown stage result: " + dispatched);
          }
          SimulatorResponse produced = ok.value();
          stage.set("limiter");
          SimulatorResponse admitted = limiters.apply(context, produced);
          long baseEnd = clock.nanoTime();
          stage.set("latency");
          return latency.apply(context, admitted).thenApply(response -> {
            stage.set("metrics");
            metrics.record(context, response.status(), baseEnd, clock.nanoTime());
            return response;
          });
        })
        .exceptionally(ex -> {
          PipelineFault.UnhandledInternalFault fault =
              new PipelineFault.UnhandledInternalFault(stage.get(), unwrap(ex));
          log.error(
              "Unhandled failure in {} stage for {} {}",
              fault.stage(),
              request.method(),
              request.path(),
              fault.cause());
          SimulatorResponse response = fault.toResponse();
          metrics.recordFault(context, response.status(), clock.nanoTime());
          return response;
        });
  }

  private static Throwable unwrap(Throwable ex) {
    Throwable current = ex;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
