package com.exo.steel.domain.pin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Mutable tracker for partial entry of a fixed-length numeric code.
 *
 * <p><strong>Thread-safety:</strong> Not thread-safe. The owning orchestrator mutates it from its flow
 * executor only and hands out {@link #copy()} snapshots.</p>
 *
 * @since 0.1.0
 */
public final class PinState {
  /** Default code length. */
  public static final int DEFAULT_LENGTH = 4;

  private static final int EMPTY = -1;

  private final int[] digits;

  /**
   * Creates an empty tracker with {@link #DEFAULT_LENGTH} slots.
   */
  public PinState() {
    this(DEFAULT_LENGTH);
  }

  /**
   * Creates an empty tracker.
   *
   * @param length number of slots (must be > 0)
   */
  public PinState(int length) {
    if (length <= 0) {
      throw new IllegalArgumentException("length must be > 0 (was " + length + ')');
    }
    this.digits = new int[length];
    Arrays.fill(digits, EMPTY);
  }

  private PinState(int[] digits) {
    this.digits = digits.clone();
  }

  /**
   * Fills the first empty slot; does nothing when the tracker is full.
   *
   * @param digit value in {@code [0,9]}
   * @return {@code true} when the digit was stored
   * @throws IllegalArgumentException if {@code digit} is not a single decimal digit
   */
  public boolean append(int digit) {
    if (digit < 0 || digit > 9) {
      throw new IllegalArgumentException("digit must be between 0 and 9 (was " + digit + ')');
    }
    for (int i = 0; i < digits.length; i++) {
      if (digits[i] == EMPTY) {
        digits[i] = digit;
        return true;
      }
    }
    return false;
  }

  /**
   * Clears the last filled slot; does nothing when empty.
   *
   * @return {@code true} when a digit was removed
   */
  public boolean removeLast() {
    for (int i = digits.length - 1; i >= 0; i--) {
      if (digits[i] != EMPTY) {
        digits[i] = EMPTY;
        return true;
      }
    }
    return false;
  }

  /**
   * Empties every slot.
   */
  public void clear() {
    Arrays.fill(digits, EMPTY);
  }

  /**
   * @return {@code true} iff no slot is empty
   */
  public boolean isComplete() {
    return enteredCount() == digits.length;
  }

  /**
   * @return number of filled slots
   */
  public int enteredCount() {
    int count = 0;
    for (int digit : digits) {
      if (digit != EMPTY) {
        count++;
      }
    }
    return count;
  }

  /**
   * @return slot count
   */
  public int length() {
    return digits.length;
  }

  /**
   * Concatenates the filled digits in slot order.
   *
   * <p>Callers submit the result only after {@link #isComplete()}; while incomplete only the digits
   * entered so far are returned.</p>
   *
   * @return entered digits, e.g. {@code "0427"}
   */
  public String asString() {
    StringBuilder sb = new StringBuilder(digits.length);
    for (int digit : digits) {
      if (digit != EMPTY) {
        sb.append((char) ('0' + digit));
      }
    }
    return sb.toString();
  }

  /**
   * @return per-slot view; empty slots are {@link Optional#empty()}
   */
  public List<Optional<Integer>> slots() {
    List<Optional<Integer>> view = new ArrayList<>(digits.length);
    for (int digit : digits) {
      view.add(digit == EMPTY ? Optional.empty() : Optional.of(digit));
    }
    return Collections.unmodifiableList(view);
  }

  /**
   * @return independent copy of this tracker
   */
  public PinState copy() {
    return new PinState(digits);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof PinState other && Arrays.equals(digits, other.digits);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(digits);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("PinState[");
    for (int i = 0; i < digits.length; i++) {
      sb.append(digits[i] == EMPTY ? '_' : '*');
    }
    return sb.append(']').toString();
  }
}
