package com.exo.steel.domain.verification;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One PIN challenge issued to a sharer.
 *
 * @param sessionId opaque unique identifier
 * @param sharerId member the PIN was delivered to
 * @param createdAt issue time
 * @param expiresAt instant after which a submitted PIN is rejected as expired
 * @param pinLength number of digits in the delivered PIN
 * @param simulatedPin PIN known locally for scripted sessions; never present for delivered ones
 * @since 0.1.0
 */
public record VerificationSession(
    String sessionId,
    String sharerId,
    Instant createdAt,
    Instant expiresAt,
    int pinLength,
    Optional<String> simulatedPin) {

  /**
   * Validates the session.
   */
  public VerificationSession {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(sharerId, "sharerId");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    simulatedPin = simulatedPin == null ? Optional.empty() : simulatedPin;
    if (pinLength <= 0) {
      throw new IllegalArgumentException("pinLength must be > 0 (was " + pinLength + ')');
    }
    if (expiresAt.isBefore(createdAt)) {
      throw new IllegalArgumentException("expiresAt must not precede createdAt");
    }
  }

  /**
   * @param now locally observed current time
   * @return {@code true} once {@code now} is strictly after {@link #expiresAt()}
   */
  public boolean isExpiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }

  @Override
  public String toString() {
    return "VerificationSession{sessionId=" + sessionId
        + ", sharerId=" + sharerId
        + ", expiresAt=" + expiresAt
        + ", pinLength=" + pinLength
        + ", simulated=" + simulatedPin.isPresent()
        + '}';
  }
}
