package com.exo.steel.application.verification;

import com.exo.steel.domain.profile.SampleProfiles;
import com.exo.steel.validation.Numbers;
import com.exo.steel.validation.Strings;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Fixed timeline and data for the scripted tap, challenge, reveal demo.
 *
 * <p>The PIN the script types is {@link #digits()}; the scripted session accepts {@link #pin()}. The two
 * match by default, so the script ends in a revealed profile.</p>
 *
 * @param sharerId identifier assumed to be read from the tag
 * @param pin PIN carried by the scripted session
 * @param digits digits typed by the script, in order
 * @param tagDetectDelay scanning to tag detected
 * @param pinEntryDelay tag detected to PIN entry
 * @param digitInterval stagger between typed digits
 * @param settleDelay last digit to submission
 * @param verifyHold submission to verify result
 * @param revealDelay verified to profile revealed
 * @param sessionTimeout lifetime of the scripted session
 * @since 0.1.0
 */
public record SimulationScript(
    String sharerId,
    String pin,
    List<Integer> digits,
    Duration tagDetectDelay,
    Duration pinEntryDelay,
    Duration digitInterval,
    Duration settleDelay,
    Duration verifyHold,
    Duration revealDelay,
    Duration sessionTimeout) {

  /** Digits typed by the default script. */
  public static final List<Integer> DEFAULT_DIGITS = List.of(1, 2, 3, 4);

  public SimulationScript {
    sharerId = Strings.requireNonBlank("simulation.sharerId", sharerId);
    pin = Strings.requireNonBlank("simulation.pin", pin);
    digits = List.copyOf(Objects.requireNonNull(digits, "digits"));
    if (digits.isEmpty()) {
      throw new IllegalArgumentException("simulation.digits must not be empty");
    }
    for (Integer digit : digits) {
      Numbers.requireRange("simulation.digits", Objects.requireNonNull(digit, "digit"), 0, 9);
    }
    requireNonNegative("tagDetectDelay", tagDetectDelay);
    requireNonNegative("pinEntryDelay", pinEntryDelay);
    requireNonNegative("digitInterval", digitInterval);
    requireNonNegative("settleDelay", settleDelay);
    requireNonNegative("verifyHold", verifyHold);
    requireNonNegative("revealDelay", revealDelay);
    requireNonNegative("sessionTimeout", sessionTimeout);
  }

  /**
   * @return the demo timeline: 0.8 s, 0.5 s, 4 x 0.4 s, 0.3 s, 1.2 s, 0.5 s
   */
  public static SimulationScript defaults() {
    return new SimulationScript(
        SampleProfiles.DEMO_MEMBER_ID,
        "1234",
        DEFAULT_DIGITS,
        Duration.ofMillis(800),
        Duration.ofMillis(500),
        Duration.ofMillis(400),
        Duration.ofMillis(300),
        Duration.ofMillis(1200),
        Duration.ofMillis(500),
        Duration.ofMinutes(2));
  }

  /**
   * @return total scripted duration from scanning to reveal
   */
  public Duration totalDuration() {
    return tagDetectDelay
        .plus(pinEntryDelay)
        .plus(digitInterval.multipliedBy(digits.size()))
        .plus(settleDelay)
        .plus(verifyHold)
        .plus(revealDelay);
  }

  private static void requireNonNegative(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) {
      throw new IllegalArgumentException("simulation." + name + " must not be negative");
    }
  }
}
