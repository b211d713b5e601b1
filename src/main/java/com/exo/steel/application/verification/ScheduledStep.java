package com.exo.steel.application.verification;

import java.time.Duration;
import java.util.Objects;

/**
 * One entry of a scripted timeline: wait {@code delay} after the previous step, then run {@code action}.
 *
 * @param name step label used in logs
 * @param delay wait relative to the previous step
 * @param action step body; runs on the flow executor
 * @since 0.1.0
 */
record ScheduledStep(String name, Duration delay, Runnable action) {
  ScheduledStep {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(action, "action");
  }
}
