package ca.gc.cra.aoaisim.api;

/**
 * <strong>What:</strong> Process exit codes returned by the simulator CLI.
 * <p><strong>Thread-safety:</strong> Immutable enum constants.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Normal termination, including help and dry-run output. */
  SUCCESS(0),
  /** Command-line arguments were malformed. */
  INVALID_ARGS(2),
  /** Recordings or configuration files could not be read, or the port could not be bound. */
  IO_ERROR(3),
  /** The effective configuration failed validation. */
  CONFIG_ERROR(4),
  /** Unexpected failure while serving. */
  RUNTIME_FAILURE(5),
  /** Interrupted while starting or serving. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return numeric process status */
  public int code() {
    return code;
  }
}
