package com.exo.steel.application.port;

import com.exo.steel.domain.profile.MemberProfile;
import com.exo.steel.domain.profile.ProfileRequest;
import java.util.concurrent.CompletableFuture;

/**
 * Profile-storage collaborator.
 *
 * <p>A {@link com.exo.steel.domain.profile.ProfileLevel#PUBLIC} request yields a profile with an empty private
 * layer. Unknown members and rejected sessions complete exceptionally.</p>
 *
 * @since 0.1.0
 */
public interface ProfilePort {
  /**
   * @param request member, level and optional verified session
   * @return requested profile view
   */
  CompletableFuture<MemberProfile> fetchProfile(ProfileRequest request);
}
