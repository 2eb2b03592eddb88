package ca.gc.cra.aoaisim.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Response-producing strategy selected at startup.
 * <p><strong>Why:</strong> The simulator either fabricates responses, proxies and records real traffic, or replays
 * recorded traffic; the choice is fixed for the life of the process.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum SimulatorMode {
  /** Synthetic responses from the generator chain. */
  GENERATE,
  /** Forward to a real upstream and capture the exchanges. */
  RECORD,
  /** Answer from previously captured exchanges. */
  REPLAY;

  /**
   * Parses a mode name, defaulting to {@link #GENERATE} when blank.
   *
   * @param value textual mode such as {@code "record"}
   * @return parsed mode
   * @throws IllegalArgumentException if the value does not name a mode
   */
  public static SimulatorMode from(String value) {
    if (value == null || value.isBlank()) {
      return GENERATE;
    }
    try {
      return SimulatorMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown mode: " + value + " (expected generate|record|replay)", ex);
    }
  }

  /** Lower-case name used in configuration and logs. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
