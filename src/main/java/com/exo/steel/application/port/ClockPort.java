package com.exo.steel.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the consent flow.
 * <p><strong>Why:</strong> Session expiry and tag timestamps are compared against an injectable clock so tests
 * can move time deterministically.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see com.exo.steel.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * @return current time as an {@link Instant}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
