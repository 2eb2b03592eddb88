package ca.gc.cra.aoaisim.infrastructure.generate;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed {@code /openai/deployments/{deployment}/{operation}} path, shared by the generators and the recorder.
 *
 * @param deployment deployment name
 * @param operation operation addressed by the path
 */
public record OpenAiRoute(String deployment, Operation operation) {
  private static final Pattern PATH =
      Pattern.compile("^/openai/deployments/([^/]+)/(chat/completions|completions|embeddings)/?$");

  public enum Operation {
    CHAT_COMPLETIONS,
    COMPLETIONS,
    EMBEDDINGS
  }

  public static Optional<OpenAiRoute> parse(String path) {
    Matcher matcher = PATH.matcher(path);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    Operation operation = switch (matcher.group(2).toLowerCase(Locale.ROOT)) {
      case "chat/completions" -> Operation.CHAT_COMPLETIONS;
      case "completions" -> Operation.COMPLETIONS;
      default -> Operation.EMBEDDINGS;
    };
    return Optional.of(new OpenAiRoute(matcher.group(1), operation));
  }
}
