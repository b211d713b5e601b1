package com.exo.steel.domain.profile;

/**
 * Networks and contact channels a member can link.
 *
 * @since 0.1.0
 */
public enum SocialPlatform {
  INSTAGRAM,
  LINKEDIN,
  TWITTER,
  PHONE,
  EMAIL,
  WEBSITE
}
