package ca.gc.cra.aoaisim.application.port;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * Completes a stage after a delay without blocking the calling thread.
 *
 * @since 0.1.0
 */
public interface DelayScheduler {
  /**
   * Returns a stage that completes once {@code delay} has elapsed.
   *
   * @param delay positive delay
   * @return stage completing normally after the delay
   */
  CompletionStage<Void> delay(Duration delay);
}
