package ca.gc.cra.aoaisim.infrastructure.scheduling;

import ca.gc.cra.aoaisim.application.port.DelayScheduler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link DelayScheduler} backed by a {@link ScheduledExecutorService}, typically the Netty worker event loop
 * group so delayed responses complete on an event loop without parking a thread.
 *
 * @since 0.1.0
 */
public final class ScheduledExecutorDelayScheduler implements DelayScheduler {
  private final ScheduledExecutorService executor;

  public ScheduledExecutorDelayScheduler(ScheduledExecutorService executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public CompletionStage<Void> delay(Duration delay) {
    Objects.requireNonNull(delay, "delay");
    CompletableFuture<Void> done = new CompletableFuture<>();
    if (delay.isZero() || delay.isNegative()) {
      done.complete(null);
      return done;
    }
    try {
      executor.schedule(() -> done.complete(null), delay.toNanos(), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException ex) {
      done.completeExceptionally(ex);
    }
    return done;
  }
}
