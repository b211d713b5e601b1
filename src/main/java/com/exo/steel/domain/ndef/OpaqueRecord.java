package com.exo.steel.domain.ndef;

import java.util.Arrays;
import java.util.Objects;

/**
 * Any record the Steel rules do not interpret (media types, malformed well-known records, empty records).
 *
 * <p>Kept so a decoded message can be re-encoded without losing foreign records.</p>
 *
 * @param tnf header type name format
 * @param typeBytes raw type field
 * @param payloadBytes raw payload field
 * @since 0.1.0
 */
public record OpaqueRecord(TypeNameFormat tnf, byte[] typeBytes, byte[] payloadBytes) implements NdefRecord {

  /**
   * Copies the byte fields.
   */
  public OpaqueRecord {
    Objects.requireNonNull(tnf, "tnf");
    typeBytes = typeBytes != null ? typeBytes.clone() : new byte[0];
    payloadBytes = payloadBytes != null ? payloadBytes.clone() : new byte[0];
  }

  @Override
  public byte[] type() {
    return typeBytes.clone();
  }

  @Override
  public byte[] payload() {
    return payloadBytes.clone();
  }

  @Override
  public byte[] typeBytes() {
    return typeBytes.clone();
  }

  @Override
  public byte[] payloadBytes() {
    return payloadBytes.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OpaqueRecord other)) {
      return false;
    }
    return tnf == other.tnf
        && Arrays.equals(typeBytes, other.typeBytes)
        && Arrays.equals(payloadBytes, other.payloadBytes);
  }

  @Override
  public int hashCode() {
    int result = tnf.hashCode();
    result = 31 * result + Arrays.hashCode(typeBytes);
    result = 31 * result + Arrays.hashCode(payloadBytes);
    return result;
  }

  @Override
  public String toString() {
    return "OpaqueRecord{tnf=" + tnf
        + ", type=" + Arrays.toString(typeBytes)
        + ", payload=" + payloadBytes.length + " bytes}";
  }
}
