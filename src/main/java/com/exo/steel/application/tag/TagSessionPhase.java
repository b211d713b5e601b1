package com.exo.steel.application.tag;

/**
 * Phases of one physical tag interaction.
 *
 * @since 0.1.0
 */
public enum TagSessionPhase {
  IDLE,
  CONNECTING,
  QUERYING_CAPABILITY,
  READING_DATA,
  WRITING_DATA,
  FINISHED
}
