package com.exo.steel.domain.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MemberProfileTest {

  @Test
  void publicViewDropsPrivateLayerOnly() {
    MemberProfile full = SampleProfiles.demoMember();

    MemberProfile preview = full.publicView();

    assertTrue(full.hasPrivateLayer());
    assertFalse(preview.hasPrivateLayer());
    assertEquals(full.fullName(), preview.fullName());
    assertEquals(full.publicSocials(), preview.publicSocials());
    assertEquals(MembershipTier.STEEL, preview.membershipTier());
  }

  @Test
  void demoMemberCarriesRequestedId() {
    MemberProfile profile = SampleProfiles.demoMember("steel_042");

    assertEquals("steel_042", profile.id());
    assertEquals("Alex Rivera", profile.fullName());
  }
}
