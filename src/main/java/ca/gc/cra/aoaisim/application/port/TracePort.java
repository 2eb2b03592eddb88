package ca.gc.cra.aoaisim.application.port;

/**
 * Starts one trace span per simulated request.
 *
 * @since 0.1.0
 */
public interface TracePort {
  /**
   * Opens a request span.
   *
   * @param method HTTP method
   * @param path request path
   * @return handle that must be ended exactly once
   */
  RequestTrace start(String method, String path);

  /** Trace port producing {@link RequestTrace#NO_OP} handles. */
  TracePort NO_OP = (method, path) -> RequestTrace.NO_OP;
}
