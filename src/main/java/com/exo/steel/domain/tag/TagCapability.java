package com.exo.steel.domain.tag;

/**
 * NDEF capability reported by a tag during the capability query.
 *
 * @since 0.1.0
 */
public enum TagCapability {
  /** Tag cannot hold an NDEF message. */
  NOT_NDEF,
  /** NDEF readable but locked against writes. */
  READ_ONLY,
  /** NDEF readable and writable. */
  READ_WRITE
}
