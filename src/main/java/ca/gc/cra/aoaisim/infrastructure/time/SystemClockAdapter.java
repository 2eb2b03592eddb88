package ca.gc.cra.aoaisim.infrastructure.time;

import ca.gc.cra.aoaisim.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  /**
   * Returns the JVM's monotonic timestamp.
   *
   * @return nanoseconds from an arbitrary origin
   * @implNote Delegates to {@link System#nanoTime()} without smoothing.
   */
  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
