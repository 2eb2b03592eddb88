package ca.gc.cra.aoaisim.domain.http;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable HTTP response produced by a pipeline stage.
 *
 * <p>Stages never mutate a response; {@link #withHeaders(Map)} returns a new instance.</p>
 *
 * @param status HTTP status code
 * @param headers response headers keyed by their canonical name, in insertion order
 * @param body response body bytes
 * @since 0.1.0
 */
public record SimulatorResponse(int status, Map<String, String> headers, byte[] body) {
  public static final String CONTENT_TYPE = "Content-Type";
  public static final String APPLICATION_JSON = "application/json";
  public static final String TEXT_PLAIN = "text/plain; charset=utf-8";

  public SimulatorResponse {
    if (status < 100 || status > 599) {
      throw new IllegalArgumentException("status must be between 100 and 599 (was " + status + ")");
    }
    headers = headers == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    body = body == null ? new byte[0] : body;
  }

  /**
   * Builds a JSON response.
   *
   * @param status HTTP status code
   * @param json serialized JSON document
   * @return response with {@code Content-Type: application/json}
   */
  public static SimulatorResponse json(int status, String json) {
    Objects.requireNonNull(json, "json");
    return new SimulatorResponse(
        status, Map.of(CONTENT_TYPE, APPLICATION_JSON), json.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Builds a plain-text response.
   *
   * @param status HTTP status code
   * @param text body text
   * @return response with a UTF-8 text content type
   */
  public static SimulatorResponse text(int status, String text) {
    Objects.requireNonNull(text, "text");
    return new SimulatorResponse(
        status, Map.of(CONTENT_TYPE, TEXT_PLAIN), text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Builds a response with no body.
   *
   * @param status HTTP status code
   * @return empty response
   */
  public static SimulatorResponse empty(int status) {
    return new SimulatorResponse(status, Map.of(), new byte[0]);
  }

  /** Returns {@code true} when the status is below 300. */
  public boolean isSuccess() {
    return status < 300;
  }

  /**
   * Returns a copy of this response with the supplied headers added or replaced.
   *
   * @param extra headers to merge over the existing ones
   * @return new response instance
   */
  public SimulatorResponse withHeaders(Map<String, String> extra) {
    Map<String, String> merged = new LinkedHashMap<>(headers);
    if (extra != null) {
      merged.putAll(extra);
    }
    return new SimulatorResponse(status, merged, body);
  }

  /**
   * Returns the first header whose name matches case-insensitively.
   *
   * @param name header name
   * @return header value or {@code null}
   */
  public String header(String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  /**
   * Decodes the body as UTF-8 text.
   *
   * @return body text
   */
  public String bodyText() {
    return new String(body, StandardCharsets.UTF_8);
  }
}
