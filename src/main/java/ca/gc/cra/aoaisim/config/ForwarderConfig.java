package ca.gc.cra.aoaisim.config;

import ca.gc.cra.aoaisim.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Upstream target used in record mode.
 *
 * @param name forwarder name from configuration
 * @param endpoint upstream base URI such as {@code https://example.openai.azure.com}
 * @param apiKey credential injected into forwarded requests
 * @param keyHeader header carrying {@code apiKey}
 * @param pathPrefix requests whose path starts with this prefix are forwarded here
 * @param limiterKey limiter applied to responses recorded through this forwarder
 * @since 0.1.0
 */
public record ForwarderConfig(
    String name,
    URI endpoint,
    String apiKey,
    String keyHeader,
    String pathPrefix,
    String limiterKey) {

  public ForwarderConfig {
    name = Strings.requireNonBlank("forwarder name", name);
    if (endpoint == null) {
      throw new IllegalArgumentException("recording.forwarders." + name + ".endpoint is required");
    }
    apiKey = Strings.requireNonBlank("recording.forwarders." + name + ".apiKey", apiKey);
    keyHeader = Strings.requireNonBlank("recording.forwarders." + name + ".keyHeader", keyHeader)
        .toLowerCase(Locale.ROOT);
    pathPrefix = Strings.requireNonBlank("recording.forwarders." + name + ".pathPrefix", pathPrefix);
    limiterKey = limiterKey == null || limiterKey.isBlank() ? null : limiterKey.trim();
  }

  static URI parseEndpoint(String key, String raw) {
    String value = Strings.requireNonBlank(key, raw);
    try {
      URI uri = new URI(value);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(key + " must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(key + " must include a host");
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(key + " must be a valid URI", ex);
    }
  }
}
