package ca.gc.cra.aoaisim.application.port;

/**
 * <strong>What:</strong> Monotonic time source for request latency measurement.
 * <p><strong>Why:</strong> Lets tests drive elapsed time deterministically through the latency emulator and the
 * metrics recorder.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads.</p>
 *
 * @implNote Default implementation delegates to {@link System#nanoTime()}.
 * @since 0.1.0
 * @see ca.gc.cra.aoaisim.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp.
   *
   * @return nanoseconds from an arbitrary origin; only differences are meaningful
   */
  long nanoTime();

  /** Default {@link ClockPort} using {@link System#nanoTime()}. */
  ClockPort SYSTEM = System::nanoTime;
}
