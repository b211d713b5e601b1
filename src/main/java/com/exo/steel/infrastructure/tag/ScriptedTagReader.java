package com.exo.steel.infrastructure.tag;

import com.exo.steel.application.port.TagHandle;
import com.exo.steel.application.port.TagReaderCancelledException;
import com.exo.steel.application.port.TagReaderPort;
import com.exo.steel.domain.tag.TagCapability;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Programmable {@link TagReaderPort} that plays back a scripted tag presentation.
 * <p><strong>Why:</strong> Exercises the tag session and live verification path on hosts without tag hardware:
 * demos, integration checks and tests.</p>
 * <p><strong>Behaviour:</strong> Each {@link #detectTags()} call consumes the next queued tag count (one tag once
 * the queue is empty). In manual mode detection stays pending until {@link #present(int)} or
 * {@link #userCancel()}. The stored message is returned by reads and replaced by writes.</p>
 * <p><strong>Thread-safety:</strong> All methods synchronize on the instance.</p>
 *
 * @since 0.1.0
 */
public final class ScriptedTagReader implements TagReaderPort {
  private static final Logger log = LoggerFactory.getLogger(ScriptedTagReader.class);

  /** Reader steps that can be scripted to fail. */
  public enum Step { DETECT, CONNECT, QUERY, READ, WRITE }

  private final Deque<Integer> detections = new ArrayDeque<>();
  private final Set<Step> failures = EnumSet.noneOf(Step.class);
  private final List<String> prompts = new ArrayList<>();
  private final List<String> announcements = new ArrayList<>();
  private final List<String> alerts = new ArrayList<>();
  private boolean available = true;
  private boolean manual;
  private boolean open;
  private TagCapability capability = TagCapability.READ_WRITE;
  private byte[] message = new byte[0];
  private CompletableFuture<List<TagHandle>> pendingDetection;
  private int detectCalls;
  private int tagSequence;

  /**
   * @param present {@code false} to simulate a device without tag hardware
   * @return this reader
   */
  public synchronized ScriptedTagReader available(boolean present) {
    this.available = present;
    return this;
  }

  /**
   * Queues the number of tags reported by the next detection calls, in order.
   *
   * @param tagCounts tags in range for successive detections
   * @return this reader
   */
  public synchronized ScriptedTagReader queueDetections(int... tagCounts) {
    for (int count : tagCounts) {
      detections.addLast(count);
    }
    return this;
  }

  /**
   * Keeps detection pending until {@link #present(int)} or {@link #userCancel()} is called.
   *
   * @return this reader
   */
  public synchronized ScriptedTagReader manualDetection() {
    this.manual = true;
    return this;
  }

  /**
   * @param value capability reported by capability queries
   * @return this reader
   */
  public synchronized ScriptedTagReader withCapability(TagCapability value) {
    this.capability = Objects.requireNonNull(value, "capability");
    return this;
  }

  /**
   * @param bytes message stored on the scripted tag
   * @return this reader
   */
  public synchronized ScriptedTagReader withMessage(byte[] bytes) {
    this.message = Objects.requireNonNull(bytes, "bytes").clone();
    return this;
  }

  /**
   * @param step reader step that completes exceptionally from now on
   * @return this reader
   */
  public synchronized ScriptedTagReader failing(Step step) {
    failures.add(Objects.requireNonNull(step, "step"));
    return this;
  }

  /**
   * Completes a pending manual detection with the given number of tags.
   *
   * @param tagCount tags in range
   * @throws IllegalStateException if no detection is pending
   */
  public void present(int tagCount) {
    CompletableFuture<List<TagHandle>> pending;
    List<TagHandle> tags;
    synchronized (this) {
      pending = takePending();
      tags = handles(tagCount);
    }
    pending.complete(tags);
  }

  /**
   * Simulates the user dismissing the reader while detection is pending.
   *
   * @throws IllegalStateException if no detection is pending
   */
  public void userCancel() {
    CompletableFuture<List<TagHandle>> pending;
    synchronized (this) {
      pending = takePending();
      open = false;
    }
    pending.completeExceptionally(new TagReaderCancelledException("Session invalidated by user"));
  }

  @Override
  public synchronized boolean isAvailable() {
    return available;
  }

  @Override
  public synchronized void begin(String prompt) {
    if (!available) {
      throw new IllegalStateException("Tag reader not available");
    }
    open = true;
    prompts.add(prompt);
    log.debug("Reader session opened: {}", prompt);
  }

  @Override
  public synchronized CompletableFuture<List<TagHandle>> detectTags() {
    detectCalls++;
    if (failures.contains(Step.DETECT)) {
      return failed(Step.DETECT);
    }
    if (manual) {
      pendingDetection = new CompletableFuture<>();
      return pendingDetection;
    }
    int count = detections.isEmpty() ? 1 : detections.removeFirst();
    return CompletableFuture.completedFuture(handles(count));
  }

  @Override
  public synchronized CompletableFuture<Void> connect(TagHandle tag) {
    return failures.contains(Step.CONNECT) ? failed(Step.CONNECT) : CompletableFuture.completedFuture(null);
  }

  @Override
  public synchronized CompletableFuture<TagCapability> queryCapability(TagHandle tag) {
    return failures.contains(Step.QUERY) ? failed(Step.QUERY) : CompletableFuture.completedFuture(capability);
  }

  @Override
  public synchronized CompletableFuture<byte[]> readMessage(TagHandle tag) {
    return failures.contains(Step.READ) ? failed(Step.READ) : CompletableFuture.completedFuture(message.clone());
  }

  @Override
  public synchronized CompletableFuture<Void> writeMessage(TagHandle tag, byte[] bytes) {
    if (failures.contains(Step.WRITE)) {
      return failed(Step.WRITE);
    }
    message = bytes.clone();
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public synchronized void announce(String text) {
    announcements.add(text);
  }

  @Override
  public void invalidate(String alertMessage) {
    CompletableFuture<List<TagHandle>> abandoned = null;
    synchronized (this) {
      open = false;
      alerts.add(alertMessage);
      if (pendingDetection != null && !pendingDetection.isDone()) {
        abandoned = pendingDetection;
      }
      pendingDetection = null;
    }
    log.debug("Reader session closed: {}", alertMessage);
    if (abandoned != null) {
      abandoned.completeExceptionally(new TagReaderCancelledException("Session invalidated"));
    }
  }

  /** @return prompts shown by {@link #begin(String)} */
  public synchronized List<String> prompts() {
    return List.copyOf(prompts);
  }

  /** @return messages shown while sessions stayed open */
  public synchronized List<String> announcements() {
    return List.copyOf(announcements);
  }

  /** @return alert messages passed to {@link #invalidate(String)} */
  public synchronized List<String> alerts() {
    return List.copyOf(alerts);
  }

  /** @return most recent invalidation alert */
  public synchronized Optional<String> lastAlert() {
    return alerts.isEmpty() ? Optional.empty() : Optional.of(alerts.get(alerts.size() - 1));
  }

  /** @return copy of the message currently stored on the tag */
  public synchronized byte[] storedMessage() {
    return message.clone();
  }

  /** @return number of detection calls so far */
  public synchronized int detectCalls() {
    return detectCalls;
  }

  /** @return {@code true} while a reader session is open */
  public synchronized boolean isOpen() {
    return open;
  }

  /** @return {@code true} while a manual detection awaits {@link #present(int)} */
  public synchronized boolean hasPendingDetection() {
    return pendingDetection != null && !pendingDetection.isDone();
  }

  private CompletableFuture<List<TagHandle>> takePending() {
    if (pendingDetection == null || pendingDetection.isDone()) {
      throw new IllegalStateException("No detection pending");
    }
    CompletableFuture<List<TagHandle>> pending = pendingDetection;
    pendingDetection = null;
    return pending;
  }

  private List<TagHandle> handles(int count) {
    List<TagHandle> tags = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      tags.add(new TagHandle("tag-" + (++tagSequence)));
    }
    return tags;
  }

  private static <T> CompletableFuture<T> failed(Step step) {
    return CompletableFuture.failedFuture(new IllegalStateException("Scripted " + step + " failure"));
  }
}
