package com.exo.steel.domain.tag;

import java.util.Objects;

/**
 * Constants that shape the three-record Steel tag payload.
 *
 * @param fallbackBaseUrl web address prefix; the member id is appended as the final path segment
 * @param externalType namespaced external record type recognised on read
 * @param recordVersion version string written into the external JSON payload
 * @param textLanguage language tag for the Text record
 * @since 0.1.0
 */
public record TagPayloadFormat(
    String fallbackBaseUrl, String externalType, String recordVersion, String textLanguage) {

  /** Fallback host used when non-members tap a tag. */
  public static final String DEFAULT_FALLBACK_BASE_URL = "https://steel.byexo.com/connect";
  /** External record type for Steel tags. */
  public static final String DEFAULT_EXTERNAL_TYPE = "com.exo.steel:connect";
  /** Current payload version. */
  public static final String DEFAULT_RECORD_VERSION = "1.0";
  /** Text record language. */
  public static final String DEFAULT_TEXT_LANGUAGE = "en";

  /**
   * Validates the constants.
   */
  public TagPayloadFormat {
    Objects.requireNonNull(fallbackBaseUrl, "fallbackBaseUrl");
    Objects.requireNonNull(externalType, "externalType");
    Objects.requireNonNull(recordVersion, "recordVersion");
    Objects.requireNonNull(textLanguage, "textLanguage");
    while (fallbackBaseUrl.endsWith("/")) {
      fallbackBaseUrl = fallbackBaseUrl.substring(0, fallbackBaseUrl.length() - 1);
    }
    if (!fallbackBaseUrl.contains("/connect")) {
      throw new IllegalArgumentException("fallbackBaseUrl must contain a /connect segment: " + fallbackBaseUrl);
    }
  }

  /**
   * @return production defaults
   */
  public static TagPayloadFormat defaults() {
    return new TagPayloadFormat(
        DEFAULT_FALLBACK_BASE_URL, DEFAULT_EXTERNAL_TYPE, DEFAULT_RECORD_VERSION, DEFAULT_TEXT_LANGUAGE);
  }
}
