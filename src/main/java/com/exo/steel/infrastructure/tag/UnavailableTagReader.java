package com.exo.steel.infrastructure.tag;

import com.exo.steel.application.port.TagHandle;
import com.exo.steel.application.port.TagReaderPort;
import com.exo.steel.domain.tag.TagCapability;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Reader for hosts without tag hardware; every live scan ends with a not-available failure.
 *
 * @since 0.1.0
 */
public final class UnavailableTagReader implements TagReaderPort {
  /** Shared instance. */
  public static final UnavailableTagReader INSTANCE = new UnavailableTagReader();

  private UnavailableTagReader() {}

  @Override
  public boolean isAvailable() {
    return false;
  }

  @Override
  public void begin(String prompt) {
    throw unavailable();
  }

  @Override
  public CompletableFuture<List<TagHandle>> detectTags() {
    return CompletableFuture.failedFuture(unavailable());
  }

  @Override
  public CompletableFuture<Void> connect(TagHandle tag) {
    return CompletableFuture.failedFuture(unavailable());
  }

  @Override
  public CompletableFuture<TagCapability> queryCapability(TagHandle tag) {
    return CompletableFuture.failedFuture(unavailable());
  }

  @Override
  public CompletableFuture<byte[]> readMessage(TagHandle tag) {
    return CompletableFuture.failedFuture(unavailable());
  }

  @Override
  public CompletableFuture<Void> writeMessage(TagHandle tag, byte[] message) {
    return CompletableFuture.failedFuture(unavailable());
  }

  @Override
  public void announce(String message) {
    // nothing to show
  }

  @Override
  public void invalidate(String alertMessage) {
    // nothing to close
  }

  private static IllegalStateException unavailable() {
    return new IllegalStateException("No tag reader available on this host");
  }
}
