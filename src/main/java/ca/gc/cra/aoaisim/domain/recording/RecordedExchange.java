package ca.gc.cra.aoaisim.domain.recording;

import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One upstream request/response pair captured in record mode.
 * <p><strong>Why:</strong> Replay mode answers matching requests with the stored response and emulates the
 * measured upstream latency.</p>
 * <p><strong>Thread-safety:</strong> Immutable; body arrays must not be mutated after construction.</p>
 *
 * @param method upper-case HTTP method
 * @param pathAndQuery request path with query string
 * @param requestHeaders request headers that are safe to persist (credentials already removed)
 * @param requestBody request body bytes
 * @param response upstream response
 * @param durationMs upstream round-trip duration in milliseconds
 * @param facts context facts captured while recording
 * @since 0.1.0
 */
public record RecordedExchange(
    String method,
    String pathAndQuery,
    Map<String, String> requestHeaders,
    byte[] requestBody,
    SimulatorResponse response,
    long durationMs,
    ExchangeFacts facts) {

  public RecordedExchange {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(pathAndQuery, "pathAndQuery");
    Objects.requireNonNull(response, "response");
    requestHeaders = requestHeaders == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(requestHeaders));
    requestBody = requestBody == null ? new byte[0] : requestBody;
    if (durationMs < 0) {
      throw new IllegalArgumentException("durationMs must be >= 0 (was " + durationMs + ")");
    }
    facts = facts == null ? ExchangeFacts.none() : facts;
  }

  /** Returns the path without its query string. */
  public String path() {
    int idx = pathAndQuery.indexOf('?');
    return idx < 0 ? pathAndQuery : pathAndQuery.substring(0, idx);
  }

  /** Returns the fingerprint used to match this exchange against replayed requests. */
  public RequestFingerprint fingerprint() {
    return RequestFingerprint.of(method, pathAndQuery, requestBody);
  }
}
