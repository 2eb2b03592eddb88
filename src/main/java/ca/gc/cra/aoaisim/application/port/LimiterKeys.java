package ca.gc.cra.aoaisim.application.port;

/**
 * Well-known limiter keys that producers place on the request context.
 *
 * @since 0.1.0
 */
public final class LimiterKeys {
  /** Per-deployment OpenAI token and request quota. */
  public static final String OPENAI = "openai";
  /** Document Intelligence requests-per-second quota. */
  public static final String DOC_INTELLIGENCE = "docintelligence";

  private LimiterKeys() {
    // Utility
  }
}
