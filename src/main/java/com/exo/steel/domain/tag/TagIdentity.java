package com.exo.steel.domain.tag;

import java.util.Objects;
import java.util.Optional;

/**
 * Sharer identity extracted from a tag.
 *
 * @param memberId non-empty member identifier
 * @param displayName optional human-readable name from the Text record
 * @since 0.1.0
 */
public record TagIdentity(String memberId, Optional<String> displayName) {

  /**
   * Validates the identifier.
   */
  public TagIdentity {
    Objects.requireNonNull(memberId, "memberId");
    if (memberId.isEmpty()) {
      throw new IllegalArgumentException("memberId must not be empty");
    }
    displayName = displayName == null ? Optional.empty() : displayName;
  }

  /**
   * Creates an identity without a display name.
   *
   * @param memberId member identifier
   * @return identity
   */
  public static TagIdentity of(String memberId) {
    return new TagIdentity(memberId, Optional.empty());
  }
}
