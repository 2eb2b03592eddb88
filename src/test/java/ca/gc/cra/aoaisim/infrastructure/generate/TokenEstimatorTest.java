package ca.gc.cra.aoaisim.infrastructure.generate;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TokenEstimatorTest {

  @Test
  void roundsUpToWholeTokens() {
    assertEquals(0, TokenEstimator.estimate(""));
    assertEquals(0, TokenEstimator.estimate(null));
    assertEquals(1, TokenEstimator.estimate("abc"));
    assertEquals(1, TokenEstimator.estimate("abcd"));
    assertEquals(2, TokenEstimator.estimate("abcde"));
  }

  @Test
  void chatCountsPerMessageOverheadAndEveryField() {
    List<Object> messages = List.of(
        Map.of("role", "system", "content", "Be brief."),
        Map.of("role", "user", "content", "Hello there"));

    // 3 priming + (3 + 2 + 3) + (3 + 1 + 3)
    assertEquals(18, TokenEstimator.estimateChat(messages));
  }

  @Test
  void chatCountsTextPartsOnly() {
    List<Object> messages = List.of(Map.of(
        "role", "user",
        "content", List.of(
            Map.of("type", "text", "text", "describe this"),
            Map.of("type", "image_url", "image_url", Map.of("url", "https://example.test/a.png")))));

    assertEquals(3 + 3 + 1 + 4, TokenEstimator.estimateChat(messages));
  }

  @Test
  void emptyConversationCostsPrimingOnly() {
    assertEquals(3, TokenEstimator.estimateChat(List.of()));
  }
}
