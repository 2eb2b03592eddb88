package ca.gc.cra.aoaisim.application.port;

/**
 * Handle on the span covering one request.
 *
 * @since 0.1.0
 */
public interface RequestTrace {
  /**
   * Sets a numeric span attribute.
   *
   * @param key attribute key
   * @param value attribute value
   */
  void setAttribute(String key, double value);

  /**
   * Sets a string span attribute.
   *
   * @param key attribute key
   * @param value attribute value
   */
  void setAttribute(String key, String value);

  /**
   * Ends the span with the final response status.
   *
   * @param statusCode HTTP status returned to the client
   */
  void end(int statusCode);

  /** Handle that ignores every call. */
  RequestTrace NO_OP = new RequestTrace() {
    @Override
    public void setAttribute(String key, double value) {}

    @Override
    public void setAttribute(String key, String value) {}

    @Override
    public void end(int statusCode) {}
  };
}
