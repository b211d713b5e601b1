package com.exo.steel.infrastructure.feedback;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.exo.steel.application.port.FeedbackEvent;
import com.exo.steel.testutil.RecordingMetrics;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingFeedbackAdapterTest {
  @Test
  void signalLogsPatternAndCountsEvent() {
    RecordingMetrics metrics = new RecordingMetrics();
    LoggingFeedbackAdapter adapter = new LoggingFeedbackAdapter(metrics, "haptics");

    Logger logger = (Logger) LoggerFactory.getLogger(LoggingFeedbackAdapter.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      adapter.signal(FeedbackEvent.TAG_DETECTED);
      adapter.signal(FeedbackEvent.PIN_INCORRECT);
      adapter.signal(FeedbackEvent.PIN_INCORRECT);
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(1L, metrics.counter("haptics.tag-detected"));
    assertEquals(2L, metrics.counter("haptics.pin-incorrect"));

    List<ILoggingEvent> events = appender.list;
    assertEquals(3, events.size());
    assertEquals("feedback event=tag-detected, pattern=impact-medium", events.get(0).getFormattedMessage());
    assertEquals("feedback event=pin-incorrect, pattern=notification-error", events.get(1).getFormattedMessage());
  }

  @Test
  void defaultPrefixIsFeedback() {
    RecordingMetrics metrics = new RecordingMetrics();
    LoggingFeedbackAdapter adapter = new LoggingFeedbackAdapter(metrics);

    adapter.signal(FeedbackEvent.PROFILE_REVEALED);

    assertEquals(1L, metrics.counter("feedback.profile-revealed"));
  }

  @Test
  void signalRejectsNullEvent() {
    RecordingMetrics metrics = new RecordingMetrics();
    LoggingFeedbackAdapter adapter = new LoggingFeedbackAdapter(metrics);

    assertThrows(NullPointerException.class, () -> adapter.signal(null));
    assertEquals(0L, metrics.counter("feedback.null"));
  }

  @Test
  void inMemoryAdapterRecordsInOrder() {
    InMemoryFeedbackAdapter adapter = new InMemoryFeedbackAdapter();
    adapter.signal(FeedbackEvent.PIN_DIGIT_ENTERED);
    adapter.signal(FeedbackEvent.PIN_CORRECT);

    assertEquals(List.of(FeedbackEvent.PIN_DIGIT_ENTERED, FeedbackEvent.PIN_CORRECT), adapter.snapshot());
    adapter.clear();
    assertEquals(List.of(), adapter.snapshot());
  }
}
