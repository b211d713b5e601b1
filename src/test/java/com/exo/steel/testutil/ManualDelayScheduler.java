package com.exo.steel.testutil;

import com.exo.steel.application.port.DelaySchedulerPort;
import com.exo.steel.application.port.ScheduledTask;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Virtual-time scheduler. Nothing runs until {@link #advance(Duration)} moves time past a task's due
 * point; tasks scheduled while advancing run in the same call when they fall due. When bound to a
 * {@link MutableClock} the clock moves with virtual time.
 */
public final class ManualDelayScheduler implements DelaySchedulerPort {
  private final List<Entry> queue = new ArrayList<>();
  private final MutableClock clock;
  private long nowNanos;
  private long sequence;

  public ManualDelayScheduler() {
    this(null);
  }

  public ManualDelayScheduler(MutableClock clock) {
    this.clock = clock;
  }

  @Override
  public ScheduledTask schedule(Duration delay, Runnable action) {
    Objects.requireNonNull(action, "action");
    Entry entry = new Entry(nowNanos + Math.max(0L, delay.toNanos()), sequence++, action);
    queue.add(entry);
    return entry;
  }

  /**
   * Moves virtual time forward, running every task that falls due in order.
   *
   * @param delta amount of virtual time to elapse
   */
  public void advance(Duration delta) {
    long target = nowNanos + delta.toNanos();
    Optional<Entry> next;
    while ((next = nextDue(target)).isPresent()) {
      Entry entry = next.get();
      queue.remove(entry);
      moveTo(entry.dueNanos);
      entry.action.run();
    }
    moveTo(target);
  }

  /** Runs everything queued, however far in the future. */
  public void runAll() {
    Optional<Entry> next;
    while ((next = nextDue(Long.MAX_VALUE)).isPresent()) {
      Entry entry = next.get();
      queue.remove(entry);
      moveTo(entry.dueNanos);
      entry.action.run();
    }
  }

  public int pendingCount() {
    return (int) queue.stream().filter(e -> !e.cancelled).count();
  }

  public Duration elapsed() {
    return Duration.ofNanos(nowNanos);
  }

  private Optional<Entry> nextDue(long target) {
    queue.removeIf(e -> e.cancelled);
    return queue.stream()
        .filter(e -> e.dueNanos <= target)
        .min(Comparator.comparingLong((Entry e) -> e.dueNanos).thenComparingLong(e -> e.sequence));
  }

  private void moveTo(long nanos) {
    if (nanos <= nowNanos) {
      return;
    }
    if (clock != null) {
      clock.advance(Duration.ofNanos(nanos - nowNanos));
    }
    nowNanos = nanos;
  }

  private static final class Entry implements ScheduledTask {
    private final long dueNanos;
    private final long sequence;
    private final Runnable action;
    private boolean cancelled;

    private Entry(long dueNanos, long sequence, Runnable action) {
      this.dueNanos = dueNanos;
      this.sequence = sequence;
      this.action = action;
    }

    @Override
    public void cancel() {
      cancelled = true;
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }
  }
}
