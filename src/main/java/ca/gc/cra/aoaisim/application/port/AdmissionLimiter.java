package ca.gc.cra.aoaisim.application.port;

import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.Optional;

/**
 * Admission control applied after a response has been produced.
 *
 * <p>Implementations keep their own synchronized counters; the registry holding them is immutable.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AdmissionLimiter {
  /**
   * Checks the request against the limiter's quota.
   *
   * @param context per-request context with the limiter key and facts set by the producer
   * @param response response produced so far
   * @return a replacement response (a denial or an annotated copy), or empty to keep {@code response}
   */
  Optional<SimulatorResponse> check(RequestContext context, SimulatorResponse response);
}
