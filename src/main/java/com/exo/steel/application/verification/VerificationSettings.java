package com.exo.steel.application.verification;

import com.exo.steel.domain.pin.PinState;
import com.exo.steel.validation.Numbers;
import java.util.Objects;

/**
 * Orchestrator tunables.
 *
 * @param pinLength tracker length used before a session announces its own
 * @param simulation scripted demo timeline
 * @since 0.1.0
 */
public record VerificationSettings(int pinLength, SimulationScript simulation) {
  public VerificationSettings {
    Numbers.requireRange("verification.pinLength", pinLength, 1, 12);
    Objects.requireNonNull(simulation, "simulation");
  }

  /**
   * @return 4-digit PIN and the default demo timeline
   */
  public static VerificationSettings defaults() {
    return new VerificationSettings(PinState.DEFAULT_LENGTH, SimulationScript.defaults());
  }
}
