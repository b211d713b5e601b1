package com.exo.steel.application.port;

/**
 * Handle to a delayed action submitted to a {@link DelaySchedulerPort}.
 *
 * @since 0.1.0
 */
public interface ScheduledTask {
  /**
   * Prevents the action from running if it has not started yet. Idempotent.
   */
  void cancel();

  /**
   * @return {@code true} once {@link #cancel()} has been called
   */
  boolean isCancelled();
}
