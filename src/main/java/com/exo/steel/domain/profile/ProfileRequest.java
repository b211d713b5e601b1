package com.exo.steel.domain.profile;

import java.util.Objects;
import java.util.Optional;

/**
 * Profile fetch request.
 *
 * @param memberId member whose profile is requested
 * @param level disclosure level
 * @param sessionId verified session backing a {@link ProfileLevel#FULL} request
 * @since 0.1.0
 */
public record ProfileRequest(String memberId, ProfileLevel level, Optional<String> sessionId) {
  public ProfileRequest {
    Objects.requireNonNull(memberId, "memberId");
    Objects.requireNonNull(level, "level");
    sessionId = sessionId == null ? Optional.empty() : sessionId;
  }

  /**
   * @param memberId member to preview
   * @return public-level request
   */
  public static ProfileRequest publicLayer(String memberId) {
    return new ProfileRequest(memberId, ProfileLevel.PUBLIC, Optional.empty());
  }

  /**
   * @param memberId member whose PIN challenge succeeded
   * @param sessionId verified session id
   * @return full-level request
   */
  public static ProfileRequest full(String memberId, String sessionId) {
    return new ProfileRequest(
        memberId, ProfileLevel.FULL, Optional.of(Objects.requireNonNull(sessionId, "sessionId")));
  }
}
