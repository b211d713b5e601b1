package com.exo.steel.domain.pin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class PinStateTest {

  @Test
  void appendFillsSlotsInOrderUntilComplete() {
    PinState pin = new PinState();
    pin.append(1);
    pin.append(2);
    pin.append(3);
    assertFalse(pin.isComplete());

    assertTrue(pin.append(4));

    assertTrue(pin.isComplete());
    assertEquals("1234", pin.asString());
    assertFalse(pin.append(5), "append on a full PIN is a no-op");
    assertEquals("1234", pin.asString());
  }

  @Test
  void removeLastThenAppendReplacesDigit() {
    PinState pin = new PinState();
    pin.append(1);
    pin.append(2);

    assertTrue(pin.removeLast());
    pin.append(5);

    assertEquals("15", pin.asString());
    assertEquals(2, pin.enteredCount());
  }

  @Test
  void removeLastOnEmptyIsNoOp() {
    PinState pin = new PinState();
    assertFalse(pin.removeLast());
    assertEquals("", pin.asString());
  }

  @Test
  void clearEmptiesEverySlot() {
    PinState pin = new PinState(6);
    pin.append(9);
    pin.append(8);

    pin.clear();

    assertEquals(0, pin.enteredCount());
    assertEquals(6, pin.slots().size());
    assertTrue(pin.slots().stream().allMatch(Optional::isEmpty));
  }

  @Test
  void slotsExposeEnteredDigits() {
    PinState pin = new PinState();
    pin.append(7);

    assertEquals(Optional.of(7), pin.slots().get(0));
    assertEquals(Optional.empty(), pin.slots().get(1));
  }

  @Test
  void outOfRangeDigitIsRejected() {
    PinState pin = new PinState();
    assertThrows(IllegalArgumentException.class, () -> pin.append(10));
    assertThrows(IllegalArgumentException.class, () -> pin.append(-1));
  }

  @Test
  void copyIsIndependent() {
    PinState pin = new PinState();
    pin.append(3);
    PinState copy = pin.copy();
    pin.append(4);

    assertEquals("3", copy.asString());
    assertNotEquals(pin, copy);
  }

  @Test
  void toStringMasksDigits() {
    PinState pin = new PinState();
    pin.append(4);
    pin.append(2);

    assertEquals("PinState[**__]", pin.toString());
  }

  @Test
  void nonPositiveLengthIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new PinState(0));
  }
}
