package ca.gc.cra.aoaisim.domain.recording;

import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * SHA-256 digest over method, path with query, and body; equal requests share a fingerprint.
 *
 * @param hex lower-case hex digest
 * @since 0.1.0
 */
public record RequestFingerprint(String hex) {

  public RequestFingerprint {
    Objects.requireNonNull(hex, "hex");
  }

  /**
   * Computes the fingerprint of an inbound request.
   *
   * @param request inbound request
   * @return fingerprint
   */
  public static RequestFingerprint of(SimulatorRequest request) {
    return of(request.method(), request.pathAndQuery(), request.body());
  }

  /**
   * Computes the fingerprint from raw request parts.
   *
   * @param method HTTP method (case-insensitive)
   * @param pathAndQuery path with optional query string
   * @param body request body
   * @return fingerprint
   */
  public static RequestFingerprint of(String method, String pathAndQuery, byte[] body) {
    MessageDigest digest = sha256();
    digest.update(method.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    digest.update((byte) '\n');
    digest.update(pathAndQuery.getBytes(StandardCharsets.UTF_8));
    digest.update((byte) '\n');
    if (body != null) {
      digest.update(body);
    }
    return new RequestFingerprint(HexFormat.of().formatHex(digest.digest()));
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
