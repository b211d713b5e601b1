package com.exo.steel.application.port;

/**
 * Raised by a {@link TagReaderPort} when the user dismissed the reader or the reader session timed out.
 *
 * <p>The tag session maps this to a cancelled outcome, never to a failure.</p>
 *
 * @since 0.1.0
 */
public final class TagReaderCancelledException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * @param message description of the cancellation source
   */
  public TagReaderCancelledException(String message) {
    super(message);
  }
}
