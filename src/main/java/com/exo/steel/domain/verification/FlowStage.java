package com.exo.steel.domain.verification;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of the tap, challenge, reveal flow with their permitted successors.
 *
 * <p>{@link #IDLE} is reachable from every stage through an explicit reset and is therefore not listed
 * as a successor.</p>
 *
 * @since 0.1.0
 */
public enum FlowStage {
  /** Waiting for a tap or a simulate request. */
  IDLE,
  /** Tag session active (or scripted scan in progress). */
  SCANNING,
  /** Sharer identifier read; PIN delivery requested. */
  TAG_DETECTED,
  /** Waiting for the receiver to enter the PIN. */
  PIN_ENTRY,
  /** PIN submitted; awaiting the verify result. */
  VERIFYING,
  /** PIN accepted; full profile requested. */
  VERIFIED,
  /** Terminal success: profile released. */
  PROFILE_REVEALED,
  /** Terminal failure carrying a {@link VerificationError}. */
  ERROR;

  /**
   * @param next candidate next stage
   * @return {@code true} when the transition follows the flow order
   */
  public boolean canAdvanceTo(FlowStage next) {
    if (next == IDLE) {
      return true;
    }
    return successors().contains(next);
  }

  /**
   * @return {@code true} for {@link #PROFILE_REVEALED} and {@link #ERROR}
   */
  public boolean isTerminal() {
    return this == PROFILE_REVEALED || this == ERROR;
  }

  /**
   * @return {@code true} for the stages during which a verification session must exist
   */
  public boolean holdsSession() {
    return this == PIN_ENTRY || this == VERIFYING || this == VERIFIED;
  }

  private Set<FlowStage> successors() {
    return switch (this) {
      case IDLE -> EnumSet.of(SCANNING);
      case SCANNING -> EnumSet.of(TAG_DETECTED, ERROR);
      case TAG_DETECTED -> EnumSet.of(PIN_ENTRY, ERROR);
      case PIN_ENTRY -> EnumSet.of(VERIFYING, ERROR);
      case VERIFYING -> EnumSet.of(VERIFIED, ERROR);
      case VERIFIED -> EnumSet.of(PROFILE_REVEALED, ERROR);
      case PROFILE_REVEALED, ERROR -> EnumSet.noneOf(FlowStage.class);
    };
  }
}
