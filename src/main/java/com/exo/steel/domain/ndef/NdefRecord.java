package com.exo.steel.domain.ndef;

/**
 * <strong>What:</strong> One typed, length-prefixed unit of an NDEF message.
 * <p><strong>Why:</strong> Lets the tag payload rules reason about URI, Text, and External records without
 * touching raw header bits.</p>
 * <p><strong>Role:</strong> Domain value produced by {@link NdefMessageCodec#decode(byte[])} and consumed by
 * {@link NdefMessageCodec#encode(NdefMessage)}.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface NdefRecord permits UriRecord, TextRecord, ExternalRecord, OpaqueRecord {
  /**
   * @return type name format written to the record header
   */
  TypeNameFormat tnf();

  /**
   * @return record type bytes (defensive copy)
   */
  byte[] type();

  /**
   * @return record payload bytes (defensive copy)
   */
  byte[] payload();
}
