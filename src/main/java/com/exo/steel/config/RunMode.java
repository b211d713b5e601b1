package com.exo.steel.config;

import java.util.Locale;

/**
 * Which verification path the composition root wires.
 *
 * @since 0.1.0
 */
public enum RunMode {
  /** Real tag reader and random delivered PINs. */
  LIVE,
  /** No tag hardware; scripted demo and a fixed PIN for delivered sessions. */
  SIMULATE;

  /**
   * @return YAML section name for this mode
   */
  public String sectionName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * @param raw mode name, case-insensitive
   * @return parsed mode
   * @throws IllegalArgumentException for unknown names
   */
  public static RunMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("mode must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown mode '" + raw + "' (expected live or simulate)", ex);
    }
  }
}
