package com.exo.steel.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.exo.steel.application.port.ScheduledTask;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScheduledExecutorDelaySchedulerTest {
  private ScheduledExecutorDelayScheduler scheduler;

  @BeforeEach
  void setUp() {
    scheduler = new ScheduledExecutorDelayScheduler(ExecutorFactories.newDelayScheduler("test-timer", null));
  }

  @AfterEach
  void tearDown() {
    scheduler.close();
  }

  @Test
  void runsActionAfterDelay() throws InterruptedException {
    CountDownLatch fired = new CountDownLatch(1);
    List<String> threads = new CopyOnWriteArrayList<>();

    scheduler.schedule(Duration.ofMillis(20), () -> {
      threads.add(Thread.currentThread().getName());
      fired.countDown();
    });

    assertTrue(fired.await(2, TimeUnit.SECONDS));
    assertTrue(threads.get(0).startsWith("test-timer-"));
  }

  @Test
  void cancelledTaskNeverRuns() throws InterruptedException {
    AtomicBoolean ran = new AtomicBoolean();
    ScheduledTask task = scheduler.schedule(Duration.ofMillis(200), () -> ran.set(true));

    task.cancel();
    Thread.sleep(300);

    assertTrue(task.isCancelled());
    assertFalse(ran.get());
  }

  @Test
  void failingActionDoesNotStopLaterTasks() throws InterruptedException {
    CountDownLatch second = new CountDownLatch(1);
    scheduler.schedule(Duration.ZERO, () -> {
      throw new IllegalStateException("boom");
    });
    scheduler.schedule(Duration.ofMillis(10), second::countDown);

    assertTrue(second.await(2, TimeUnit.SECONDS));
  }

  @Test
  void rejectsNegativeDelay() {
    assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(Duration.ofMillis(-1), () -> { }));
  }

  @Test
  void flowExecutorRunsTasksSeriallyInOrder() throws InterruptedException {
    ExecutorService flow = ExecutorFactories.newFlowExecutor("test-flow", null);
    List<Integer> order = new CopyOnWriteArrayList<>();
    try {
      for (int i = 0; i < 50; i++) {
        int value = i;
        flow.execute(() -> order.add(value));
      }
    } finally {
      flow.shutdown();
    }

    assertTrue(flow.awaitTermination(2, TimeUnit.SECONDS));
    assertEquals(50, order.size());
    for (int i = 0; i < 50; i++) {
      assertEquals(i, order.get(i));
    }
  }
}
