package com.exo.steel.infrastructure.exec;

import com.exo.steel.application.port.DelaySchedulerPort;
import com.exo.steel.application.port.ScheduledTask;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DelaySchedulerPort} backed by a {@link ScheduledExecutorService}.
 *
 * @since 0.1.0
 */
public final class ScheduledExecutorDelayScheduler implements DelaySchedulerPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorDelayScheduler.class);

  private final ScheduledExecutorService scheduler;

  /**
   * @param scheduler executor that runs the delayed actions; owned by this adapter
   */
  public ScheduledExecutorDelayScheduler(ScheduledExecutorService scheduler) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @Override
  public ScheduledTask schedule(Duration delay, Runnable action) {
    Objects.requireNonNull(delay, "delay");
    Objects.requireNonNull(action, "action");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    ScheduledFuture<?> future = scheduler.schedule(() -> {
      try {
        action.run();
      } catch (RuntimeException ex) {
        log.error("Scheduled action failed", ex);
      }
    }, delay.toNanos(), TimeUnit.NANOSECONDS);
    return new FutureTask(future);
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
  }

  private static final class FutureTask implements ScheduledTask {
    private final ScheduledFuture<?> future;

    private FutureTask(ScheduledFuture<?> future) {
      this.future = future;
    }

    @Override
    public void cancel() {
      future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return future.isCancelled();
    }
  }
}
