package ca.gc.cra.aoaisim.infrastructure.limiter;

import ca.gc.cra.aoaisim.application.port.ClockPort;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Fixed-window counters keyed by string, acquired all-or-nothing.
 * <p><strong>Why:</strong> An OpenAI call consumes both a request slot and its tokens; a denial on either quota
 * must leave the other untouched.</p>
 * <p><strong>Thread-safety:</strong> All access is synchronized on the counter.</p>
 *
 * @since 0.1.0
 */
public final class FixedWindowCounter {
  private final ClockPort clock;
  private final Map<String, Window> windows = new HashMap<>();

  public FixedWindowCounter(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Acquires every quota or none of them.
   *
   * @param quotas quotas to charge
   * @return decision with the remaining allowance per quota, in input order
   */
  public synchronized Decision tryAcquire(List<Quota> quotas) {
    long now = clock.nanoTime();
    List<Window> resolved = new ArrayList<>(quotas.size());
    Duration retryAfter = Duration.ZERO;
    boolean granted = true;
    for (Quota quota : quotas) {
      Window window = windows.computeIfAbsent(quota.key(), k -> new Window(now));
      window.roll(now, quota.window().toNanos());
      resolved.add(window);
      if (window.used + quota.cost() > quota.limit()) {
        granted = false;
        Duration reset = Duration.ofNanos(window.remainingNanos(now, quota.window().toNanos()));
        if (reset.compareTo(retryAfter) > 0) {
          retryAfter = reset;
        }
      }
    }
    List<Long> remaining = new ArrayList<>(quotas.size());
    for (int i = 0; i < quotas.size(); i++) {
      Quota quota = quotas.get(i);
      Window window = resolved.get(i);
      if (granted) {
        window.used += quota.cost();
      }
      remaining.add(Math.max(0L, quota.limit() - window.used));
    }
    return new Decision(granted, List.copyOf(remaining), granted ? Duration.ZERO : retryAfter);
  }

  /**
   * One quota to charge.
   *
   * @param key counter key, e.g. {@code openai:gpt-4:requests}
   * @param limit allowance per window
   * @param window window length
   * @param cost units to charge
   */
  public record Quota(String key, long limit, Duration window, long cost) {
    public Quota {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(window, "window");
      if (window.isZero() || window.isNegative()) {
        throw new IllegalArgumentException("window must be positive");
      }
      if (cost < 0) {
        throw new IllegalArgumentException("cost must be >= 0 (was " + cost + ")");
      }
    }
  }

  /**
   * Outcome of an acquisition.
   *
   * @param granted {@code true} when every quota was charged
   * @param remaining allowance left per quota after the call
   * @param retryAfter time until the most constrained denied window resets; zero when granted
   */
  public record Decision(boolean granted, List<Long> remaining, Duration retryAfter) {}

  private static final class Window {
    private long startNanos;
    private long used;

    private Window(long startNanos) {
      this.startNanos = startNanos;
    }

    private void roll(long now, long lengthNanos) {
      if (now - startNanos >= lengthNanos) {
        long elapsedWindows = (now - startNanos) / lengthNanos;
        startNanos += elapsedWindows * lengthNanos;
        used = 0;
      }
    }

    private long remainingNanos(long now, long lengthNanos) {
      return Math.max(0L, lengthNanos - (now - startNanos));
    }
  }
}
