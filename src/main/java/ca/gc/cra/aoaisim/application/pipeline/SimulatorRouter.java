package ca.gc.cra.aoaisim.application.pipeline;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.application.port.RecordReplayPort;
import ca.gc.cra.aoaisim.application.port.RequestTrace;
import ca.gc.cra.aoaisim.application.port.TracePort;
import ca.gc.cra.aoaisim.config.SimulatorConfig;
import ca.gc.cra.aoaisim.config.SimulatorMode;
import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits inbound traffic between the management endpoints and the simulation pipeline.
 *
 * <ul>
 *   <li>{@code GET /}: liveness, no authentication.</li>
 *   <li>{@code POST /++/save-recordings}: persist recordings, record mode only.</li>
 *   <li>{@code GET /++/config}: effective configuration without credentials.</li>
 *   <li>anything else: {@link RequestPipeline} inside a request span.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class SimulatorRouter {
  public static final String SAVE_RECORDINGS_PATH = "/++/save-recordings";
  public static final String CONFIG_PATH = "/++/config";

  private static final Logger log = LoggerFactory.getLogger(SimulatorRouter.class);
  private static final String LIVENESS_BODY = "{\"message\":\"aoai-simulator is running\"}";

  private final SimulatorConfig config;
  private final CredentialValidator credentials;
  private final RequestPipeline pipeline;
  private final RecordReplayPort recordReplay;
  private final TracePort tracing;
  private final JsonSupport json;

  public SimulatorRouter(
      SimulatorConfig config,
      CredentialValidator credentials,
      RequestPipeline pipeline,
      RecordReplayPort recordReplay,
      TracePort tracing,
      JsonSupport json) {
    this.config = Objects.requireNonNull(config, "config");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.recordReplay = Objects.requireNonNull(recordReplay, "recordReplay");
    this.tracing = tracing == null ? TracePort.NO_OP : tracing;
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Routes a request.
   *
   * @param request inbound request
   * @return stage that always completes normally with the response to send
   */
  public CompletionStage<SimulatorResponse> route(SimulatorRequest request) {
    try {
      String method = request.method();
      String path = request.path();
      if ("GET".equals(method) && "/".equals(path)) {
        return CompletableFuture.completedFuture(SimulatorResponse.json(200, LIVENESS_BODY));
      }
      if ("POST".equals(method) && SAVE_RECORDINGS_PATH.equals(path)) {
        return saveRecordings(request);
      }
      if ("GET".equals(method) && CONFIG_PATH.equals(path)) {
        return CompletableFuture.completedFuture(effectiveConfig(request));
      }
      return simulate(request);
    } catch (RuntimeException ex) {
      log.error("Unhandled routing failure for {} {}", request.method(), request.path(), ex);
      return CompletableFuture.completedFuture(SimulatorResponse.empty(500));
    }
  }

  private CompletionStage<SimulatorResponse> simulate(SimulatorRequest request) {
    RequestTrace trace = tracing.start(request.method(), request.path());
    return pipeline.handle(request, trace).whenComplete((response, ex) -> {
      int status = response != null ? response.status() : 500;
      trace.end(status);
    });
  }

  private CompletionStage<SimulatorResponse> saveRecordings(SimulatorRequest request) {
    StageResult<CredentialCarrier> auth = credentials.validate(request);
    if (auth instanceof StageResult.Failed<CredentialCarrier> failed) {
      return CompletableFuture.completedFuture(failed.fault().toResponse());
    }
    if (config.mode() != SimulatorMode.RECORD) {
      log.warn("Not saving recordings as not in record mode (mode={})", config.mode().label());
      return CompletableFuture.completedFuture(
          SimulatorResponse.text(400, "Not saving recordings as not in record mode"));
    }
    return recordReplay.save().handle((ignored, ex) -> {
      if (ex != null) {
        log.error("Failed to save recordings", ex);
        return SimulatorResponse.text(500, "Failed to save recordings");
      }
      log.info("Recordings saved on request");
      return SimulatorResponse.text(200, "Recordings saved");
    });
  }

  private SimulatorResponse effectiveConfig(SimulatorRequest request) {
    StageResult<CredentialCarrier> auth = credentials.validate(request);
    if (auth instanceof StageResult.Failed<CredentialCarrier> failed) {
      return failed.fault().toResponse();
    }
    Map<String, Object> view = config.toRedactedView();
    return SimulatorResponse.json(200, json.toJson(view));
  }
}
