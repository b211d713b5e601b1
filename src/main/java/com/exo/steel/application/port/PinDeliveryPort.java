package com.exo.steel.application.port;

import com.exo.steel.domain.verification.VerificationSession;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> PIN-delivery collaborator that texts a one-time PIN to the sharer and later checks it.
 * <p><strong>Contract:</strong> Failures complete the returned future exceptionally, typically with
 * {@link CollaboratorException}.</p>
 *
 * @since 0.1.0
 */
public interface PinDeliveryPort {
  /**
   * Issues a new challenge and delivers its PIN to the sharer.
   *
   * @param sharerId member read from the tag
   * @return the issued session; never carries the PIN for delivered challenges
   */
  CompletableFuture<VerificationSession> sendPin(String sharerId);

  /**
   * Checks a PIN against a session with exact string equality.
   *
   * @param sessionId session returned by {@link #sendPin(String)}
   * @param pin entered digits
   * @return {@code true} when the PIN matches an unexpired session
   */
  CompletableFuture<Boolean> verifyPin(String sessionId, String pin);
}
