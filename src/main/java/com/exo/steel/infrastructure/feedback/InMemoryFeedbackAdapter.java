package com.exo.steel.infrastructure.feedback;

import com.exo.steel.application.port.FeedbackEvent;
import com.exo.steel.application.port.FeedbackPort;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory feedback sink used for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryFeedbackAdapter implements FeedbackPort {
  private final CopyOnWriteArrayList<FeedbackEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void signal(FeedbackEvent event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * @return immutable snapshot of signalled events in order
   */
  public List<FeedbackEvent> snapshot() {
    return List.copyOf(events);
  }

  /**
   * Clears the captured events.
   */
  public void clear() {
    events.clear();
  }
}
