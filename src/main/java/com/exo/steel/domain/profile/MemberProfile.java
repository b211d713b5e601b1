package com.exo.steel.domain.profile;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A member's profile split into a public layer and a private layer.
 *
 * <p>The private layer (phone, email, private socials) is released only after a successful PIN
 * challenge. {@link #publicView()} strips it.</p>
 *
 * @param id member identifier stored on the tag
 * @param firstName given name
 * @param lastName family name
 * @param headline short tagline
 * @param bio free-form description
 * @param avatarUrl optional avatar image address
 * @param membershipTier membership level
 * @param publicSocials links visible before verification
 * @param phoneNumber private phone number
 * @param email private email address
 * @param privateSocials links released after verification
 * @since 0.1.0
 */
public record MemberProfile(
    String id,
    String firstName,
    String lastName,
    String headline,
    String bio,
    Optional<String> avatarUrl,
    MembershipTier membershipTier,
    List<SocialLink> publicSocials,
    Optional<String> phoneNumber,
    Optional<String> email,
    List<SocialLink> privateSocials) {

  public MemberProfile {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(firstName, "firstName");
    Objects.requireNonNull(lastName, "lastName");
    headline = headline == null ? "" : headline;
    bio = bio == null ? "" : bio;
    avatarUrl = avatarUrl == null ? Optional.empty() : avatarUrl;
    Objects.requireNonNull(membershipTier, "membershipTier");
    publicSocials = publicSocials == null ? List.of() : List.copyOf(publicSocials);
    phoneNumber = phoneNumber == null ? Optional.empty() : phoneNumber;
    email = email == null ? Optional.empty() : email;
    privateSocials = privateSocials == null ? List.of() : List.copyOf(privateSocials);
  }

  /**
   * @return first and last name separated by a space
   */
  public String fullName() {
    return firstName + ' ' + lastName;
  }

  /**
   * @return {@code true} when any private field is populated
   */
  public boolean hasPrivateLayer() {
    return phoneNumber.isPresent() || email.isPresent() || !privateSocials.isEmpty();
  }

  /**
   * @return copy with the private layer emptied
   */
  public MemberProfile publicView() {
    return new MemberProfile(
        id,
        firstName,
        lastName,
        headline,
        bio,
        avatarUrl,
        membershipTier,
        publicSocials,
        Optional.empty(),
        Optional.empty(),
        List.of());
  }
}
