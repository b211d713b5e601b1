package com.exo.steel.domain.verification;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the orchestrator's current stage.
 *
 * <p>Instances are replaced wholesale on every transition, so a listener never observes a half-applied
 * change.</p>
 *
 * @param stage current stage
 * @param sharerId sharer identifier, present from {@link FlowStage#TAG_DETECTED} onward
 * @param error failure reason, present only in {@link FlowStage#ERROR}
 * @since 0.1.0
 */
public record VerificationFlowState(FlowStage stage, Optional<String> sharerId, Optional<VerificationError> error) {
  private static final VerificationFlowState IDLE =
      new VerificationFlowState(FlowStage.IDLE, Optional.empty(), Optional.empty());
  private static final VerificationFlowState SCANNING =
      new VerificationFlowState(FlowStage.SCANNING, Optional.empty(), Optional.empty());

  /**
   * Enforces that only {@link FlowStage#ERROR} carries an error.
   */
  public VerificationFlowState {
    Objects.requireNonNull(stage, "stage");
    sharerId = sharerId == null ? Optional.empty() : sharerId;
    error = error == null ? Optional.empty() : error;
    if ((stage == FlowStage.ERROR) != error.isPresent()) {
      throw new IllegalArgumentException("error reason must be present exactly in the ERROR stage");
    }
  }

  /** @return idle state */
  public static VerificationFlowState idle() {
    return IDLE;
  }

  /** @return scanning state */
  public static VerificationFlowState scanning() {
    return SCANNING;
  }

  /**
   * @param sharerId identifier read from the tag
   * @return tag-detected state
   */
  public static VerificationFlowState tagDetected(String sharerId) {
    return new VerificationFlowState(
        FlowStage.TAG_DETECTED, Optional.of(Objects.requireNonNull(sharerId, "sharerId")), Optional.empty());
  }

  /**
   * @param sharerId sharer owning the challenge
   * @return PIN entry state
   */
  public static VerificationFlowState pinEntry(String sharerId) {
    return of(FlowStage.PIN_ENTRY, sharerId);
  }

  /**
   * @param sharerId sharer owning the challenge
   * @return verifying state
   */
  public static VerificationFlowState verifying(String sharerId) {
    return of(FlowStage.VERIFYING, sharerId);
  }

  /**
   * @param sharerId sharer owning the challenge
   * @return verified state
   */
  public static VerificationFlowState verified(String sharerId) {
    return of(FlowStage.VERIFIED, sharerId);
  }

  /**
   * @param sharerId sharer whose profile was released
   * @return terminal success state
   */
  public static VerificationFlowState profileRevealed(String sharerId) {
    return of(FlowStage.PROFILE_REVEALED, sharerId);
  }

  /**
   * @param reason failure reason
   * @param sharerId sharer involved, if known
   * @return terminal error state
   */
  public static VerificationFlowState error(VerificationError reason, Optional<String> sharerId) {
    return new VerificationFlowState(
        FlowStage.ERROR, sharerId, Optional.of(Objects.requireNonNull(reason, "reason")));
  }

  private static VerificationFlowState of(FlowStage stage, String sharerId) {
    return new VerificationFlowState(stage, Optional.ofNullable(sharerId), Optional.empty());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(stage.name());
    sharerId.ifPresent(id -> sb.append("(sharer=").append(id).append(')'));
    error.ifPresent(reason -> sb.append('(').append(reason).append(')'));
    return sb.toString();
  }
}
