package ca.gc.cra.aoaisim.domain.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class SimulatorResponseTest {

  @Test
  void jsonSetsContentType() {
    SimulatorResponse response = SimulatorResponse.json(200, "{}");

    assertEquals("application/json", response.header("content-type"));
    assertEquals("{}", response.bodyText());
    assertTrue(response.isSuccess());
  }

  @Test
  void withHeadersReturnsNewInstance() {
    SimulatorResponse original = SimulatorResponse.text(429, "slow down");

    SimulatorResponse updated = original.withHeaders(Map.of("Retry-After", "10"));

    assertNull(original.header("retry-after"));
    assertEquals("10", updated.header("retry-after"));
    assertEquals(SimulatorResponse.TEXT_PLAIN, updated.header("Content-Type"));
    assertFalse(updated.isSuccess());
  }

  @Test
  void rejectsInvalidStatus() {
    assertThrows(IllegalArgumentException.class, () -> SimulatorResponse.empty(42));
    assertThrows(IllegalArgumentException.class, () -> SimulatorResponse.empty(600));
  }
}
