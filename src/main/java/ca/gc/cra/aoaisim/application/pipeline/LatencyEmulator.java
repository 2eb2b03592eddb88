package ca.gc.cra.aoaisim.application.pipeline;

import ca.gc.cra.aoaisim.application.port.ClockPort;
import ca.gc.cra.aoaisim.application.port.DelayScheduler;
import ca.gc.cra.aoaisim.application.port.context.RequestContext;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delays successful responses so their total time matches the duration hint on the context.
 *
 * <p>Only responses with status below 300 are delayed. The extra delay is the hint minus the time elapsed since
 * authentication; when positive it is scheduled without blocking and reported as the
 * {@value #ADDED_LATENCY_ATTRIBUTE} span attribute, in seconds.</p>
 *
 * @since 0.1.0
 */
public final class LatencyEmulator {
  public static final String ADDED_LATENCY_ATTRIBUTE = "simulator.added_latency";

  private static final Logger log = LoggerFactory.getLogger(LatencyEmulator.class);
  private static final long NANOS_PER_MILLI = 1_000_000L;

  private final ClockPort clock;
  private final DelayScheduler scheduler;

  public LatencyEmulator(ClockPort clock, DelayScheduler scheduler) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  /**
   * Applies the latency hint.
   *
   * @param context per-request context carrying the start timestamp and hint
   * @param response response after limiter resolution
   * @return stage completing with {@code response} once any extra delay has elapsed
   */
  public CompletionStage<SimulatorResponse> apply(RequestContext context, SimulatorResponse response) {
    if (!response.isSuccess()) {
      return CompletableFuture.completedFuture(response);
    }
    long targetNanos = context.recordedDurationMs().orElse(0L) * NANOS_PER_MILLI;
    long elapsedNanos = clock.nanoTime() - context.startNanos();
    long extraNanos = targetNanos - elapsedNanos;
    if (extraNanos <= 0) {
      return CompletableFuture.completedFuture(response);
    }
    double extraSeconds = extraNanos / 1_000_000_000.0;
    context.trace().setAttribute(ADDED_LATENCY_ATTRIBUTE, extraSeconds);
    log.debug("Adding {} ms latency to {}", extraNanos / NANOS_PER_MILLI, context.request().path());
    return scheduler.delay(Duration.ofNanos(extraNanos)).thenApply(ignored -> response);
  }
}
