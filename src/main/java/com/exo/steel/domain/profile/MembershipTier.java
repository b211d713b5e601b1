package com.exo.steel.domain.profile;

/**
 * Membership level shown next to a member's name.
 *
 * @since 0.1.0
 */
public enum MembershipTier {
  DIGITAL("Digital"),
  STEEL("Steel"),
  ELITE("Elite");

  private final String displayName;

  MembershipTier(String displayName) {
    this.displayName = displayName;
  }

  /**
   * @return label rendered in profile cards
   */
  public String displayName() {
    return displayName;
  }
}
