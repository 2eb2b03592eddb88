package ca.gc.cra.aoaisim.application.pipeline;

import ca.gc.cra.aoaisim.application.port.AdmissionLimiter;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable map from limiter key to {@link AdmissionLimiter}.
 * <p><strong>Role:</strong> Pipeline stage between the producer and latency emulation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the limiter named by the context's limiter key.</li>
 *   <li>Pass the response through unchanged when no key is set or no limiter is registered.</li>
 *   <li>Otherwise return the limiter's replacement, or the original when it returns none.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The map is fixed at construction; limiters synchronize their own counters.</p>
 *
 * @since 0.1.0
 */
public final class LimiterRegistry {
  private static final Logger log = LoggerFactory.getLogger(LimiterRegistry.class);

  private final Map<String, AdmissionLimiter> limiters;

  /**
   * Creates a registry.
   *
   * @param limiters limiters keyed by limiter key; copied
   */
  public LimiterRegistry(Map<String, AdmissionLimiter> limiters) {
    this.limiters = Map.copyOf(Objects.requireNonNull(limiters, "limiters"));
  }

  /**
   * Applies the limiter selected by the context.
   *
   * @param context per-request context
   * @param response produced response
   * @return the response to continue with
   */
  public SimulatorResponse apply(RequestContext context, SimulatorResponse response) {
    Optional<String> key = context.limiterKey();
    if (key.isEmpty()) {
      log.debug("No limiter key for {}; passing response through", context.request().path());
      return response;
    }
    AdmissionLimiter limiter = limiters.get(key.get());
    if (limiter == null) {
      log.debug("No limiter registered for key '{}'; passing response through", key.get());
      return response;
    }
    return limiter.check(context, response).orElse(response);
  }

  /** Returns the registered keys. */
  public Set<String> keys() {
    return limiters.keySet();
  }
}
