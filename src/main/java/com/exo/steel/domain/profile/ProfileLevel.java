package com.exo.steel.domain.profile;

import java.util.Locale;

/**
 * Disclosure level requested from the profile backend.
 *
 * @since 0.1.0
 */
public enum ProfileLevel {
  /** Public layer only; private fields are empty. */
  PUBLIC,
  /** Public and private layers; requires a verified session. */
  FULL;

  /**
   * @return lower-case wire value ({@code "public"} or {@code "full"})
   */
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
