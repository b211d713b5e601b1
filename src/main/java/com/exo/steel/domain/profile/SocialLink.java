package com.exo.steel.domain.profile;

import java.util.Objects;

/**
 * One linked account or contact channel.
 *
 * @param platform network or channel kind
 * @param handle user-facing handle, e.g. {@code @alex.rivera}
 * @since 0.1.0
 */
public record SocialLink(SocialPlatform platform, String handle) {
  public SocialLink {
    Objects.requireNonNull(platform, "platform");
    Objects.requireNonNull(handle, "handle");
  }
}
