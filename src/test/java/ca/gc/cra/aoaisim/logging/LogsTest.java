package ca.gc.cra.aoaisim.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("short", Logs.truncate("short", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void truncateAppendsLengthMetadata() {
    String result = Logs.truncate("abcdefghij", 4);

    assertEquals("abcd... (truncated, 4 of 10)", result);
  }

  @Test
  void truncateDropsSplitCodepoint() {
    String result = Logs.truncate("éé", 3);

    assertTrue(result.startsWith("é..."), result);
  }

  @Test
  void truncateRejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void maskKeepsLastCharacters() {
    assertEquals("***123", Logs.mask("secret-key-123"));
    assertEquals("***", Logs.mask("short"));
    assertEquals("<null>", Logs.mask(null));
  }
}
