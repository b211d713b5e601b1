package com.exo.steel.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueInsideBounds() {
    assertEquals(4L, Numbers.requireRange("verification.pinLength", 4, 1, 12));
    assertEquals(1L, Numbers.requireRange("verification.pinLength", 1, 1, 12));
  }

  @Test
  void requireRangeNamesTheValueOnFailure() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("verification.pinLength", 13, 1, 12));

    assertTrue(ex.getMessage().startsWith("verification.pinLength must be between 1 and 12"));
  }
}
