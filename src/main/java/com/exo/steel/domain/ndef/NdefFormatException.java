package com.exo.steel.domain.ndef;

/**
 * Raised when a byte stream is not a structurally valid NDEF message.
 *
 * @since 0.1.0
 */
public final class NdefFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception describing the structural fault.
   *
   * @param message diagnostic message
   */
  public NdefFormatException(String message) {
    super(message);
  }
}
