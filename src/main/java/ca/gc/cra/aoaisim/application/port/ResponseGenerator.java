package ca.gc.cra.aoaisim.application.port;

import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Produces synthetic responses in generate mode.
 *
 * <p>Implementations set the limiter key, deployment name, token count and optional duration hint on the
 * context for every response they produce. An empty result means the request is not handled.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ResponseGenerator {
  /**
   * Generates a response for the request held by {@code context}.
   *
   * @param context per-request context
   * @return stage yielding a response, or empty when no generator handles the request
   */
  CompletionStage<Optional<SimulatorResponse>> generate(RequestContext context);
}
