package com.exo.steel.domain.profile;

import java.util.List;
import java.util.Optional;

/**
 * Demo member used by the scripted simulation and the in-memory directory.
 *
 * @since 0.1.0
 */
public final class SampleProfiles {
  /** Identifier of the demo sharer. */
  public static final String DEMO_MEMBER_ID = "steel_001";

  private SampleProfiles() {}

  /**
   * @return the demo member profile with both layers populated
   */
  public static MemberProfile demoMember() {
    return demoMember(DEMO_MEMBER_ID);
  }

  /**
   * @param memberId identifier to assign
   * @return the demo member profile under the given identifier
   */
  public static MemberProfile demoMember(String memberId) {
    return new MemberProfile(
        memberId,
        "Alex",
        "Rivera",
        "Creative Director | NYC",
        "Building the future of digital identity and curated experiences.",
        Optional.of("https://randomuser.me/api/portraits/men/32.jpg"),
        MembershipTier.STEEL,
        List.of(
            new SocialLink(SocialPlatform.INSTAGRAM, "@alex.rivera"),
            new SocialLink(SocialPlatform.LINKEDIN, "LinkedIn"),
            new SocialLink(SocialPlatform.PHONE, "Contact")),
        Optional.of("+1 (555) 123-4567"),
        Optional.of("alex@exo.dev"),
        List.of(new SocialLink(SocialPlatform.TWITTER, "@alexr_creates")));
  }
}
