package com.exo.steel.infrastructure.sms;

import java.time.Instant;
import java.util.Objects;

/**
 * PIN handed to the dispatch hook for delivery to the sharer.
 *
 * @param sessionId session the PIN belongs to
 * @param sharerId recipient member
 * @param pin clear-text PIN; never log it unmasked
 * @param expiresAt session expiry
 * @since 0.1.0
 */
public record IssuedPin(String sessionId, String sharerId, String pin, Instant expiresAt) {
  public IssuedPin {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(sharerId, "sharerId");
    Objects.requireNonNull(pin, "pin");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  @Override
  public String toString() {
    return "IssuedPin{sessionId=" + sessionId + ", sharerId=" + sharerId + ", expiresAt=" + expiresAt + '}';
  }
}
