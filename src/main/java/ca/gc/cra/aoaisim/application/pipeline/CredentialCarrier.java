package ca.gc.cra.aoaisim.application.pipeline;

/**
 * Header that carried the accepted credential, in precedence order.
 *
 * @since 0.1.0
 */
public enum CredentialCarrier {
  /** {@code Authorization} header; trusted without validation. */
  BEARER("authorization"),
  /** {@code api-key} header compared with the configured key. */
  API_KEY("api-key"),
  /** {@code ocp-apim-subscription-key} header compared with the configured key. */
  SUBSCRIPTION_KEY("ocp-apim-subscription-key");

  private final String headerName;

  CredentialCarrier(String headerName) {
    this.headerName = headerName;
  }

  /** Lower-case header name. */
  public String headerName() {
    return headerName;
  }
}
