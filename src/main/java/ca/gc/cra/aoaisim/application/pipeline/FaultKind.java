package ca.gc.cra.aoaisim.application.pipeline;

/**
 * Categories of pipeline faults; each maps to exactly one HTTP outcome.
 *
 * @since 0.1.0
 */
public enum FaultKind {
  /** No accepted credential on the request. */
  AUTHENTICATION,
  /** The active producer returned no response. */
  DISPATCH,
  /** Unexpected failure inside a stage. */
  INTERNAL
}
