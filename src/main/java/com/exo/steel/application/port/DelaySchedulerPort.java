package com.exo.steel.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Runs an action once after a delay.
 * <p><strong>Why:</strong> Scripted simulation steps and multi-tag retry waits go through this port so tests can
 * advance virtual time instead of sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept submissions from any thread.</p>
 *
 * @since 0.1.0
 */
public interface DelaySchedulerPort {
  /**
   * @param delay non-negative delay
   * @param action action to run
   * @return handle that can cancel the pending action
   */
  ScheduledTask schedule(Duration delay, Runnable action);
}
