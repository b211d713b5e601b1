package com.exo.steel.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void maskPinKeepsLengthOnly() {
    assertEquals("****", Logs.maskPin("1234"));
    assertEquals("<null>", Logs.maskPin(null));
  }

  @Test
  void truncateLeavesShortValuesAlone() {
    assertEquals("Alex Rivera", Logs.truncate("Alex Rivera", 32));
  }

  @Test
  void truncateCutsOnByteBudget() {
    String result = Logs.truncate("abcdefghij", 4);

    assertTrue(result.startsWith("abcd... (truncated, 4 of 10)"), result);
  }

  @Test
  void truncateNeverSplitsCodepointIntoGarbage() {
    // "é" is two bytes in UTF-8; a 3-byte budget ends mid-character.
    String result = Logs.truncate("éé", 3);

    assertTrue(result.startsWith("é..."), result);
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
