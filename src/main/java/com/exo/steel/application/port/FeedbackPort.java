package com.exo.steel.application.port;

/**
 * Injected receiver of feedback cues (haptics, sounds).
 *
 * @since 0.1.0
 */
public interface FeedbackPort {
  /**
   * @param event cue to emit; never {@code null}
   */
  void signal(FeedbackEvent event);

  /**
   * Feedback sink that ignores all cues.
   */
  FeedbackPort NO_OP = event -> {};
}
