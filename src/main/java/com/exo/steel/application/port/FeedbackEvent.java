package com.exo.steel.application.port;

import java.util.Locale;

/**
 * Named user feedback cues emitted by the consent flow.
 *
 * @since 0.1.0
 */
public enum FeedbackEvent {
  TAG_DETECTED,
  PIN_DIGIT_ENTERED,
  PIN_CORRECT,
  PIN_INCORRECT,
  PROFILE_REVEALED;

  /**
   * @return kebab-case name, e.g. {@code pin-correct}
   */
  public String eventName() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
