package ca.gc.cra.aoaisim.application.pipeline;

import ca.gc.cra.aoaisim.domain.http.SimulatorRequest;
import ca.gc.cra.aoaisim.validation.Strings;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides whether an inbound request carries an accepted credential.
 * <p><strong>Role:</strong> First pipeline stage; also guards the management endpoints.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept any non-blank {@code Authorization} header without further validation.</li>
 *   <li>Otherwise compare {@code api-key}, then {@code ocp-apim-subscription-key}, with the configured key in
 *   constant time.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Logs accepted bearer tokens at INFO and rejections at WARN; credential values
 * are never logged.</p>
 *
 * @since 0.1.0
 */
public final class CredentialValidator {
  private static final Logger log = LoggerFactory.getLogger(CredentialValidator.class);

  private final byte[] expectedKey;

  /**
   * Creates a validator for the shared simulator key.
   *
   * @param apiKey configured key; must be non-blank
   */
  public CredentialValidator(String apiKey) {
    this.expectedKey = Strings.requireNonBlank("apiKey", apiKey).getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Validates the credential headers of {@code request}.
   *
   * @param request inbound request
   * @return the accepted carrier, or an {@link PipelineFault.AuthenticationFailure}
   */
  public StageResult<CredentialCarrier> validate(SimulatorRequest request) {
    Optional<String> bearer = request.header(CredentialCarrier.BEARER.headerName());
    if (bearer.isPresent() && !bearer.get().isBlank()) {
      log.info("Accepting Authorization header for {} {} without validation", request.method(), request.path());
      return StageResult.ok(CredentialCarrier.BEARER);
    }
    if (matches(request.header(CredentialCarrier.API_KEY.headerName()))) {
      return StageResult.ok(CredentialCarrier.API_KEY);
    }
    if (matches(request.header(CredentialCarrier.SUBSCRIPTION_KEY.headerName()))) {
      return StageResult.ok(CredentialCarrier.SUBSCRIPTION_KEY);
    }
    log.warn("Missing or incorrect API key for {} {}", request.method(), request.path());
    return StageResult.failed(new PipelineFault.AuthenticationFailure());
  }

  private boolean matches(Optional<String> candidate) {
    if (candidate.isEmpty() || candidate.get().isEmpty()) {
      return false;
    }
    return MessageDigest.isEqual(candidate.get().getBytes(StandardCharsets.UTF_8), expectedKey);
  }
}
