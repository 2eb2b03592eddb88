package ca.gc.cra.aoaisim.application.port;

import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * <strong>What:</strong> Produces responses in record and replay modes.
 * <p><strong>Role:</strong> Port invoked by the mode dispatcher; implemented by the recording engine.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Record mode: forward upstream, buffer the exchange, set the context facts.</li>
 *   <li>Replay mode: answer from a matching recording and set the recorded duration hint.</li>
 *   <li>Persist buffered recordings on {@link #save()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must serialize buffer mutation against saves.</p>
 *
 * @since 0.1.0
 */
public interface RecordReplayPort {
  /**
   * Handles a request in record or replay mode.
   *
   * @param context per-request context
   * @return stage yielding a response, or empty when nothing matches
   */
  CompletionStage<Optional<SimulatorResponse>> handle(RequestContext context);

  /**
   * Persists recordings buffered since the last save. Saving with nothing pending is a no-op.
   *
   * @return stage completing once the recordings are durable
   */
  CompletionStage<Void> save();
}
