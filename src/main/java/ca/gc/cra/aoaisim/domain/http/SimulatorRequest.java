package ca.gc.cra.aoaisim.domain.http;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable view of an inbound HTTP request as seen by the simulator pipeline.
 * <p><strong>Why:</strong> Keeps pipeline stages independent of the Netty transport types.</p>
 * <p><strong>Role:</strong> Domain value passed from the HTTP adapter to routing, pipeline and producers.</p>
 * <p><strong>Thread-safety:</strong> Immutable apart from the body array, which callers must not mutate.</p>
 *
 * @param method upper-case HTTP method
 * @param path request path without query string, always starting with {@code /}
 * @param query raw query string without the leading {@code ?}; empty when absent
 * @param headers header values keyed by lower-case header name
 * @param body request body bytes; empty when absent
 * @since 0.1.0
 */
public record SimulatorRequest(
    String method,
    String path,
    String query,
    Map<String, List<String>> headers,
    byte[] body) {

  /**
   * Normalizes method and header names and copies header lists.
   */
  public SimulatorRequest {
    method = Objects.requireNonNull(method, "method").trim().toUpperCase(Locale.ROOT);
    path = Objects.requireNonNull(path, "path");
    if (!path.startsWith("/")) {
      path = "/" + path;
    }
    query = query == null ? "" : query;
    headers = normalizeHeaders(headers);
    body = body == null ? new byte[0] : body;
  }

  /**
   * Creates a request from a raw URI such as {@code /openai/deployments/x/embeddings?api-version=1}.
   *
   * @param method HTTP method
   * @param uri request target including optional query string
   * @param headers request headers (any case)
   * @param body request body bytes
   * @return request value
   */
  public static SimulatorRequest of(
      String method, String uri, Map<String, List<String>> headers, byte[] body) {
    Objects.requireNonNull(uri, "uri");
    int idx = uri.indexOf('?');
    String path = idx < 0 ? uri : uri.substring(0, idx);
    String query = idx < 0 ? "" : uri.substring(idx + 1);
    return new SimulatorRequest(method, path, query, headers, body);
  }

  /**
   * Returns the first value of a header, matching the name case-insensitively.
   *
   * @param name header name
   * @return first header value when present
   */
  public Optional<String> header(String name) {
    List<String> values = headers.get(name.toLowerCase(Locale.ROOT));
    if (values == null || values.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(values.get(0));
  }

  /**
   * Returns the path plus query string, as it appeared on the request line.
   *
   * @return path with {@code ?query} appended when a query is present
   */
  public String pathAndQuery() {
    return query.isEmpty() ? path : path + "?" + query;
  }

  /**
   * Decodes the body as UTF-8 text.
   *
   * @return body text
   */
  public String bodyText() {
    return new String(body, StandardCharsets.UTF_8);
  }

  private static Map<String, List<String>> normalizeHeaders(Map<String, List<String>> raw) {
    if (raw == null || raw.isEmpty()) {
      return Map.of();
    }
    Map<String, List<String>> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        continue;
      }
      normalized
          .computeIfAbsent(entry.getKey().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
          .addAll(entry.getValue());
    }
    Map<String, List<String>> copy = new LinkedHashMap<>();
    normalized.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(copy);
  }
}
