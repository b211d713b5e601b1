package com.exo.steel.infrastructure.feedback;

import com.exo.steel.application.port.FeedbackEvent;
import com.exo.steel.application.port.FeedbackPort;
import com.exo.steel.application.port.MetricsPort;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes feedback cues to the log and counts them, standing in for device haptics.
 *
 * @since 0.1.0
 */
public final class LoggingFeedbackAdapter implements FeedbackPort {
  private static final Logger log = LoggerFactory.getLogger(LoggingFeedbackAdapter.class);

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters; defaults to {@code feedback}
   */
  public LoggingFeedbackAdapter(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "feedback" : metricPrefix.trim();
  }

  /**
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingFeedbackAdapter(MetricsPort metrics) {
    this(metrics, "feedback");
  }

  @Override
  public void signal(FeedbackEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment(metricPrefix + '.' + event.eventName());
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("event=" + event.eventName());
    joiner.add("pattern=" + pattern(event));
    log.info("feedback {}", joiner);
  }

  private static String pattern(FeedbackEvent event) {
    return switch (event) {
      case TAG_DETECTED -> "impact-medium";
      case PIN_DIGIT_ENTERED -> "impact-light";
      case PIN_CORRECT -> "notification-success";
      case PIN_INCORRECT -> "notification-error";
      case PROFILE_REVEALED -> "impact-heavy";
    };
  }
}
