package com.exo.steel.domain.ndef;

/**
 * Type Name Format values carried in the low three bits of an NDEF record header.
 *
 * @since 0.1.0
 */
public enum TypeNameFormat {
  /** Record carries no type, id, or payload. */
  EMPTY(0x00),
  /** NFC Forum well-known type (RTD), e.g. {@code U} or {@code T}. */
  WELL_KNOWN(0x01),
  /** RFC 2046 media type. */
  MEDIA(0x02),
  /** Absolute URI type. */
  ABSOLUTE_URI(0x03),
  /** NFC Forum external type ({@code domain:type}). */
  EXTERNAL(0x04),
  /** Unknown payload type. */
  UNKNOWN(0x05),
  /** Continuation chunk of a chunked payload. */
  UNCHANGED(0x06),
  /** Reserved by the NFC Forum. */
  RESERVED(0x07);

  private final int code;

  TypeNameFormat(int code) {
    this.code = code;
  }

  /**
   * @return three-bit wire value
   */
  public int code() {
    return code;
  }

  /**
   * Resolves the wire value found in a record header.
   *
   * @param header full header byte; only the low three bits are inspected
   * @return matching format
   */
  public static TypeNameFormat fromHeader(int header) {
    int value = header & 0x07;
    for (TypeNameFormat tnf : values()) {
      if (tnf.code == value) {
        return tnf;
      }
    }
    throw new IllegalStateException("unreachable TNF " + value);
  }
}
