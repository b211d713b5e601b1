package com.exo.steel.domain.verification;

import com.exo.steel.domain.tag.TagError;

/**
 * Reasons a verification flow ends in {@link FlowStage#ERROR}.
 *
 * <p>Every value carries stable UI copy; tag-session failures keep their specific reason.</p>
 *
 * @since 0.1.0
 */
public enum VerificationError {
  NFC_NOT_AVAILABLE("NFC is not available on this device."),
  CONNECTION_FAILED("Couldn't connect to the Steel tag. Try again."),
  CAPABILITY_QUERY_FAILED("Couldn't read the Steel tag status. Try again."),
  NOT_NDEF_COMPATIBLE("This tag is not NDEF compatible."),
  READ_ONLY_TAG("This tag is read-only."),
  TAG_READ_FAILED("Couldn't read the Steel tag. Try again."),
  TAG_WRITE_FAILED("Couldn't write the Steel tag. Try again."),
  EMPTY_TAG("No data found on this tag."),
  INVALID_TAG("This doesn't appear to be a valid Steel tag."),
  PIN_INCORRECT("Incorrect PIN. Please check with the sharer."),
  PIN_EXPIRED("Verification timed out. Tap again to retry."),
  NETWORK_ERROR("Connection error. Please check your network."),
  /**
   * Reserved for a sharer rejecting the connection request from their own device. No path in this core
   * produces it; the value exists so UI copy stays stable once a connection backend reports rejections.
   */
  SHARER_DECLINED("The sharer has declined this connection.");

  private final String message;

  VerificationError(String message) {
    this.message = message;
  }

  /**
   * @return human-readable reason suitable for differentiated UI copy
   */
  public String message() {
    return message;
  }

  /**
   * Maps a tag session failure to its flow reason.
   *
   * @param error tag session failure
   * @return matching flow reason
   */
  public static VerificationError fromTagError(TagError error) {
    return switch (error) {
      case NOT_AVAILABLE -> NFC_NOT_AVAILABLE;
      case CONNECTION_FAILED -> CONNECTION_FAILED;
      case CAPABILITY_QUERY_FAILED -> CAPABILITY_QUERY_FAILED;
      case NOT_NDEF_COMPATIBLE -> NOT_NDEF_COMPATIBLE;
      case READ_ONLY_TAG -> READ_ONLY_TAG;
      case READ_FAILED -> TAG_READ_FAILED;
      case WRITE_FAILED -> TAG_WRITE_FAILED;
      case EMPTY_TAG -> EMPTY_TAG;
      case INVALID_TAG_FORMAT -> INVALID_TAG;
    };
  }
}
