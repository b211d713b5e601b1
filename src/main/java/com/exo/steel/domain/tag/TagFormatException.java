package com.exo.steel.domain.tag;

/**
 * Raised when tag data yields no Steel member identifier.
 *
 * @since 0.1.0
 */
public final class TagFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a diagnostic message.
   *
   * @param message diagnostic detail
   */
  public TagFormatException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping a lower-level cause.
   *
   * @param message diagnostic detail
   * @param cause underlying failure
   */
  public TagFormatException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return always {@link TagError#INVALID_TAG_FORMAT}
   */
  public TagError error() {
    return TagError.INVALID_TAG_FORMAT;
  }
}
