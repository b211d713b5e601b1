package com.exo.steel.domain.tag;

/**
 * Hardware, session, and format failures resolved at the tag session boundary.
 *
 * <p>Cancellation is deliberately absent: a cancelled session is an outcome, not an error.</p>
 *
 * @since 0.1.0
 */
public enum TagError {
  /** Reader hardware missing or disabled. */
  NOT_AVAILABLE("NFC is not available on this device."),
  /** Could not detect or connect to the presented tag. */
  CONNECTION_FAILED("Could not connect to the NFC tag."),
  /** Capability query returned an error. */
  CAPABILITY_QUERY_FAILED("Could not read tag status."),
  /** Tag does not speak NDEF. */
  NOT_NDEF_COMPATIBLE("This tag is not NDEF compatible."),
  /** Write requested on a read-only tag. */
  READ_ONLY_TAG("This tag is read-only."),
  /** Read command failed. */
  READ_FAILED("Failed to read the NFC tag."),
  /** Write command failed. */
  WRITE_FAILED("Failed to write the NFC tag."),
  /** Tag holds no NDEF data. */
  EMPTY_TAG("No data found on tag."),
  /** Tag data does not carry a Steel identifier. */
  INVALID_TAG_FORMAT("This is not a valid Steel tag.");

  private final String message;

  TagError(String message) {
    this.message = message;
  }

  /**
   * @return stable human-readable description suitable for UI copy
   */
  public String message() {
    return message;
  }
}
