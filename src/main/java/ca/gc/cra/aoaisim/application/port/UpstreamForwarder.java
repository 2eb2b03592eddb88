package ca.gc.cra.aoaisim.application.port;

import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import java.util.concurrent.CompletionStage;

/**
 * Sends a request to a real upstream endpoint in record mode.
 *
 * @since 0.1.0
 */
public interface UpstreamForwarder {
  /**
   * Indicates whether this forwarder handles the request.
   *
   * @param request inbound request
   * @return {@code true} when the request path falls under this forwarder
   */
  boolean matches(SimulatorRequest request);

  /**
   * Forwards the request.
   *
   * @param request inbound request
   * @return stage yielding the upstream exchange
   */
  CompletionStage<ForwardedExchange> forward(SimulatorRequest request);
}
