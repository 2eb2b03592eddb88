package ca.gc.cra.aoaisim.infrastructure.generate;

import java.util.List;
import java.util.Map;

/**
 * Approximates OpenAI token counts without a tokenizer: about four characters per token, plus the fixed chat
 * overhead of three tokens per message and three for priming the reply.
 *
 * @since 0.1.0
 */
public final class TokenEstimator {
  static final int CHARS_PER_TOKEN = 4;
  static final int TOKENS_PER_MESSAGE = 3;
  static final int REPLY_PRIMING_TOKENS = 3;

  private TokenEstimator() {
    // Utility
  }

  /**
   * Estimates tokens in a piece of text.
   *
   * @param text text; {@code null} counts as empty
   * @return {@code 0} for empty text, otherwise {@code ceil(length / 4)}
   */
  public static long estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
  }

  /**
   * Estimates prompt tokens for a chat request.
   *
   * @param messages parsed {@code messages} array
   * @return estimated prompt tokens
   */
  public static long estimateChat(List<?> messages) {
    long total = REPLY_PRIMING_TOKENS;
    for (Object message : messages) {
      total += TOKENS_PER_MESSAGE;
      if (message instanceof Map<?, ?> fields) {
        for (Map.Entry<?, ?> field : fields.entrySet()) {
          total += estimateValue(field.getValue());
        }
      }
    }
    return total;
  }

  private static long estimateValue(Object value) {
    if (value instanceof String s) {
      return estimate(s);
    }
    if (value instanceof List<?> parts) {
      long total = 0;
      for (Object part : parts) {
        if (part instanceof Map<?, ?> fields && fields.get("text") instanceof String text) {
          total += estimate(text);
        }
      }
      return total;
    }
    return 0;
  }
}
