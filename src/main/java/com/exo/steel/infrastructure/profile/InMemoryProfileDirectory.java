package com.exo.steel.infrastructure.profile;

import com.exo.steel.application.port.CollaboratorException;
import com.exo.steel.application.port.ProfilePort;
import com.exo.steel.domain.profile.MemberProfile;
import com.exo.steel.domain.profile.ProfileLevel;
import com.exo.steel.domain.profile.ProfileRequest;
import com.exo.steel.domain.profile.SampleProfiles;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process profile store with public and full disclosure levels.
 *
 * <p>A {@link ProfileLevel#PUBLIC} request returns {@link MemberProfile#publicView()}. A
 * {@link ProfileLevel#FULL} request needs a session id accepted by the session authorizer. Unknown members
 * and rejected sessions complete exceptionally with {@link CollaboratorException}.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryProfileDirectory implements ProfilePort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryProfileDirectory.class);

  private final ConcurrentMap<String, MemberProfile> profiles = new ConcurrentHashMap<>();
  private final BiPredicate<String, String> sessionAuthorizer;

  /**
   * @param sessionAuthorizer accepts {@code (sessionId, memberId)} pairs allowed to read the full layer
   */
  public InMemoryProfileDirectory(BiPredicate<String, String> sessionAuthorizer) {
    this.sessionAuthorizer = Objects.requireNonNull(sessionAuthorizer, "sessionAuthorizer");
  }

  /**
   * @param sessionAuthorizer accepts {@code (sessionId, memberId)} pairs allowed to read the full layer
   * @return directory seeded with the demo member
   */
  public static InMemoryProfileDirectory withDemoMember(BiPredicate<String, String> sessionAuthorizer) {
    InMemoryProfileDirectory directory = new InMemoryProfileDirectory(sessionAuthorizer);
    directory.put(SampleProfiles.demoMember());
    return directory;
  }

  /**
   * Inserts or replaces a profile.
   *
   * @param profile profile to store
   */
  public void put(MemberProfile profile) {
    Objects.requireNonNull(profile, "profile");
    profiles.put(profile.id(), profile);
  }

  @Override
  public CompletableFuture<MemberProfile> fetchProfile(ProfileRequest request) {
    Objects.requireNonNull(request, "request");
    MemberProfile profile = profiles.get(request.memberId());
    if (profile == null) {
      log.info("Profile {} not found", request.memberId());
      return CompletableFuture.failedFuture(new CollaboratorException("fetchProfile", "Profile not found"));
    }
    if (request.level() == ProfileLevel.PUBLIC) {
      return CompletableFuture.completedFuture(profile.publicView());
    }
    String sessionId = request.sessionId().orElse(null);
    if (sessionId == null || !sessionAuthorizer.test(sessionId, request.memberId())) {
      log.warn("Full profile of {} refused: session not verified", request.memberId());
      return CompletableFuture.failedFuture(
          new CollaboratorException("fetchProfile", "Verification session required for full profile"));
    }
    log.debug("Releasing full profile of {} for session {}", request.memberId(), sessionId);
    return CompletableFuture.completedFuture(profile);
  }
}
