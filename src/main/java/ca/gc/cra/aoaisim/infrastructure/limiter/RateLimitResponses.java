package ca.gc.cra.aoaisim.infrastructure.limiter;

import ca.gc.cra.aoaisim.application.json.JsonSupport;
import ca.gc.cra.aoaisim.domain.http.SimulatorResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds 429 responses in the shape Azure services return them. */
final class RateLimitResponses {
  private RateLimitResponses() {
    // Utility
  }

  static SimulatorResponse tooManyRequests(JsonSupport json, String message, Duration retryAfter) {
    long retrySeconds = Math.max(1L, (retryAfter.toMillis() + 999) / 1000);
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", "429");
    error.put("message", message.replace("{seconds}", Long.toString(retrySeconds)));
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Retry-After", Long.toString(retrySeconds));
    headers.put("retry-after-ms", Long.toString(Math.max(0L, retryAfter.toMillis())));
    return SimulatorResponse.json(429, json.toJson(Map.of("error", error))).withHeaders(headers);
  }
}
