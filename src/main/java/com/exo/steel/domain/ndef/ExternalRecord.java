package com.exo.steel.domain.ndef;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * NFC Forum external type record ({@code TNF=EXTERNAL}) such as {@code com.exo.steel:connect}.
 *
 * @param typeName namespaced external type name
 * @param payloadBytes application payload; copied on the way in and out
 * @since 0.1.0
 */
public record ExternalRecord(String typeName, byte[] payloadBytes) implements NdefRecord {

  /**
   * Copies the payload so the record stays immutable.
   */
  public ExternalRecord {
    Objects.requireNonNull(typeName, "typeName");
    if (typeName.isEmpty()) {
      throw new IllegalArgumentException("typeName must not be empty");
    }
    payloadBytes = payloadBytes != null ? payloadBytes.clone() : new byte[0];
  }

  @Override
  public TypeNameFormat tnf() {
    return TypeNameFormat.EXTERNAL;
  }

  @Override
  public byte[] type() {
    return typeName.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public byte[] payload() {
    return payloadBytes.clone();
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
    if (!(o instanceof ExternalRecord other)) {
      return false;
    }
    return typeName.equals(other.typeName) && Arrays.equals(payloadBytes, other.payloadBytes);
  }

  @Override
  public int hashCode() {
    return 31 * typeName.hashCode() + Arrays.hashCode(payloadBytes);
  }

  @Override
  public String toString() {
    return "ExternalRecord{typeName=" + typeName + ", payloadBytes=" + payloadBytes.length + " bytes}";
  }
}
