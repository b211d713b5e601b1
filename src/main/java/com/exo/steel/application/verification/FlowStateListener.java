package com.exo.steel.application.verification;

import com.exo.steel.domain.verification.VerificationFlowState;

/**
 * Receives every flow transition in order.
 *
 * <p>Invoked on the orchestrator's flow executor; implementations must not block.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface FlowStateListener {
  /**
   * @param previous state before the transition
   * @param next state after the transition
   */
  void onTransition(VerificationFlowState previous, VerificationFlowState next);
}
