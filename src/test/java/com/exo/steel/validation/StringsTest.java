package com.exo.steel.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("steel_001", Strings.requireNonBlank("memberId", "  steel_001  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("memberId", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsNull() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("memberId", null));
  }

  @Test
  void requireDigitsAcceptsExactLength() {
    assertEquals("0427", Strings.requireDigits("pin", "0427", 4));
  }

  @Test
  void requireDigitsRejectsWrongLengthOrLetters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDigits("pin", "123", 4));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireDigits("pin", "12a4", 4));
  }
}
