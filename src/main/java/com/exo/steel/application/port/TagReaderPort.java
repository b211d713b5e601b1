package com.exo.steel.application.port;

import com.exo.steel.domain.tag.TagCapability;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> Hardware-agnostic proximity tag reader/writer.
 * <p><strong>Why:</strong> The tag session drives connect, capability query and read/write through this port so it
 * can be exercised with scripted readers.</p>
 * <p><strong>Contract:</strong> Futures complete exceptionally with {@link TagReaderCancelledException} when the
 * user dismisses the reader; any other exceptional completion is a hardware failure of that step.</p>
 * <p><strong>Thread-safety:</strong> One reader session at a time; callers serialize access.</p>
 *
 * @since 0.1.0
 */
public interface TagReaderPort {
  /**
   * @return {@code true} when the device has usable tag hardware
   */
  boolean isAvailable();

  /**
   * Opens a reader session and shows the prompt to the user.
   *
   * @param prompt message displayed while waiting for a tag
   */
  void begin(String prompt);

  /**
   * Polls until at least one tag is in range.
   *
   * @return every tag currently presented; never empty on normal completion
   */
  CompletableFuture<List<TagHandle>> detectTags();

  /**
   * @param tag tag to connect to
   * @return future completing once connected
   */
  CompletableFuture<Void> connect(TagHandle tag);

  /**
   * @param tag connected tag
   * @return NDEF capability of the tag
   */
  CompletableFuture<TagCapability> queryCapability(TagHandle tag);

  /**
   * @param tag connected tag
   * @return raw message bytes; empty when the tag carries no message
   */
  CompletableFuture<byte[]> readMessage(TagHandle tag);

  /**
   * @param tag connected, writable tag
   * @param message raw message bytes
   * @return future completing once written
   */
  CompletableFuture<Void> writeMessage(TagHandle tag, byte[] message);

  /**
   * Updates the message shown while the reader session stays open.
   *
   * @param message user-facing text
   */
  void announce(String message);

  /**
   * Closes the reader session.
   *
   * @param alertMessage final user-facing text shown as the reader closes
   */
  void invalidate(String alertMessage);
}
