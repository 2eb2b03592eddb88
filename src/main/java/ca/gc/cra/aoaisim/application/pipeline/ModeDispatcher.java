package ca.gc.cra.aoaisim.application.pipeline;

import ca.gc.cra.aoaisim.application.port.RecordReplayPort;
import ca.gc.cra.aoaisim.application.port.ResponseGenerator;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.config.SimulatorMode;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Routes an authenticated request to the producer of the configured mode.
 *
 * <p>{@code generate} uses the generator; {@code record} and {@code replay} use the record/replay engine. An
 * empty producer result becomes a {@link PipelineFault.DispatchFault}.</p>
 *
 * @since 0.1.0
 */
public final class ModeDispatcher {
  private final SimulatorMode mode;
  private final ResponseGenerator generator;
  private final RecordReplayPort recordReplay;

  /**
   * Creates a dispatcher for a fixed mode.
   *
   * @param mode process-wide mode
   * @param generator producer for generate mode
   * @param recordReplay producer for record and replay modes
   */
  public ModeDispatcher(SimulatorMode mode, ResponseGenerator generator, RecordReplayPort recordReplay) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.generator = Objects.requireNonNull(generator, "generator");
    this.recordReplay = Objects.requireNonNull(recordReplay, "recordReplay");
  }

  /**
   * Invokes the active producer.
   *
   * @param context per-request context
   * @return stage yielding the produced response or a dispatch fault
   */
  public CompletionStage<StageResult<SimulatorResponse>> dispatch(RequestContext context) {
    CompletionStage<Optional<SimulatorResponse>> produced = switch (mode) {
      case GENERATE -> generator.generate(context);
      case RECORD, REPLAY -> recordReplay.handle(context);
    };
    String path = context.request().path();
    return produced.thenApply(response -> response
        .<StageResult<SimulatorResponse>>map(StageResult::ok)
        .orElseGet(() -> StageResult.failed(new PipelineFault.DispatchFault(path))));
  }

  public SimulatorMode mode() {
    return mode;
  }
}
