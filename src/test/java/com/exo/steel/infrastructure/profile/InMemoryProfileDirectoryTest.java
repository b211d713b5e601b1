package com.exo.steel.infrastructure.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.exo.steel.application.port.CollaboratorException;
import com.exo.steel.domain.profile.MemberProfile;
import com.exo.steel.domain.profile.ProfileRequest;
import com.exo.steel.domain.profile.SampleProfiles;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class InMemoryProfileDirectoryTest {

  @Test
  void publicRequestStripsPrivateLayer() {
    InMemoryProfileDirectory directory = InMemoryProfileDirectory.withDemoMember((session, member) -> false);

    MemberProfile profile = directory.fetchProfile(ProfileRequest.publicLayer("steel_001")).join();

    assertEquals("Alex Rivera", profile.fullName());
    assertFalse(profile.hasPrivateLayer());
    assertEquals(3, profile.publicSocials().size());
  }

  @Test
  void fullRequestWithAuthorizedSessionReturnsEverything() {
    InMemoryProfileDirectory directory = InMemoryProfileDirectory.withDemoMember(
        (session, member) -> session.equals("s-1") && member.equals("steel_001"));

    MemberProfile profile = directory.fetchProfile(ProfileRequest.full("steel_001", "s-1")).join();

    assertTrue(profile.hasPrivateLayer());
    assertEquals(SampleProfiles.demoMember(), profile);
  }

  @Test
  void fullRequestWithUnverifiedSessionFails() {
    InMemoryProfileDirectory directory = InMemoryProfileDirectory.withDemoMember((session, member) -> false);

    ExecutionException ex = assertThrows(ExecutionException.class,
        () -> directory.fetchProfile(ProfileRequest.full("steel_001", "s-1")).get());
    assertInstanceOf(CollaboratorException.class, ex.getCause());
  }

  @Test
  void unknownMemberFails() {
    InMemoryProfileDirectory directory = InMemoryProfileDirectory.withDemoMember((session, member) -> true);

    ExecutionException ex = assertThrows(ExecutionException.class,
        () -> directory.fetchProfile(ProfileRequest.publicLayer("steel_404")).get());
    assertEquals("fetchProfile", ((CollaboratorException) ex.getCause()).operation());
  }

  @Test
  void putReplacesExistingProfile() {
    InMemoryProfileDirectory directory = new InMemoryProfileDirectory((session, member) -> true);
    directory.put(SampleProfiles.demoMember("steel_777"));

    MemberProfile profile = directory.fetchProfile(ProfileRequest.publicLayer("steel_777")).join();

    assertEquals("steel_777", profile.id());
  }
}
