package com.exo.steel.application.tag;

import com.exo.steel.application.port.ClockPort;
import com.exo.steel.application.port.DelaySchedulerPort;
import com.exo.steel.application.port.MetricsPort;
import com.exo.steel.application.port.ScheduledTask;
import com.exo.steel.application.port.TagHandle;
import com.exo.steel.application.port.TagReaderCancelledException;
import com.exo.steel.application.port.TagReaderPort;
import com.exo.steel.domain.tag.TagCapability;
import com.exo.steel.domain.tag.TagError;
import com.exo.steel.domain.tag.TagFormatException;
import com.exo.steel.domain.tag.TagIdentity;
import com.exo.steel.domain.tag.TagPayloadCodec;
import com.exo.steel.logging.Logs;
import com.exo.steel.validation.Strings;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> State machine for one physical tag interaction: connect, query capability, then read or
 * write, then finish.
 * <p><strong>Why:</strong> Keeps hardware sequencing, multi-tag retries and cancellation out of the verification
 * flow, which only sees a single {@link TagSessionOutcome}.</p>
 * <p><strong>Lifecycle:</strong> Single use. {@link #startRead()} or {@link #startWrite(String, String)} may be
 * called once from {@link TagSessionPhase#IDLE}; the returned future completes exactly once.</p>
 * <p><strong>Thread-safety:</strong> Reader callbacks may arrive on any thread. Phase changes are guarded by the
 * instance monitor and the outcome future is completed at most once; every continuation checks it before
 * touching the reader.</p>
 * <p><strong>Observability:</strong> Emits {@code tag.session.<outcome>}, {@code tag.session.error.<reason>} and
 * {@code tag.session.multiTagRetry}.</p>
 *
 * @since 0.1.0
 */
public final class TagSession {
  private static final Logger log = LoggerFactory.getLogger(TagSession.class);

  static final String MULTI_TAG_ALERT = "More than 1 tag detected. Please use only one Steel card.";
  static final String CANCELLED_ALERT = "Scan cancelled.";

  private enum Mode { READ, WRITE }

  private final TagReaderPort reader;
  private final TagPayloadCodec codec;
  private final DelaySchedulerPort scheduler;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final TagSessionSettings settings;
  private final CompletableFuture<TagSessionOutcome> outcome = new CompletableFuture<>();

  private TagSessionPhase phase = TagSessionPhase.IDLE;
  private Mode mode;
  private String writeMemberId;
  private String writeDisplayName;
  private int multiTagRetries;
  private ScheduledTask pendingRetry;
  private boolean readerOpen;
  private boolean finished;

  /**
   * Creates a session over the given reader.
   *
   * @param reader tag hardware port
   * @param codec payload codec used for decoding reads and encoding writes
   * @param scheduler delay source for multi-tag retry waits
   * @param clock timestamp source for written payloads
   * @param metrics metrics sink
   * @param settings retry policy and prompts
   */
  public TagSession(
      TagReaderPort reader,
      TagPayloadCodec codec,
      DelaySchedulerPort scheduler,
      ClockPort clock,
      MetricsPort metrics,
      TagSessionSettings settings) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Starts a read interaction.
   *
   * @return future completing with the terminal outcome
   * @throws IllegalStateException if the session was already started
   */
  public CompletableFuture<TagSessionOutcome> startRead() {
    begin(Mode.READ);
    openReader(settings.readPrompt());
    return outcome;
  }

  /**
   * Starts a write interaction that stores the member's three-record payload.
   *
   * @param memberId identifier to store
   * @param displayName human-readable name stored in the text record
   * @return future completing with the terminal outcome
   * @throws IllegalStateException if the session was already started
   */
  public CompletableFuture<TagSessionOutcome> startWrite(String memberId, String displayName) {
    String id = Strings.requireNonBlank("memberId", memberId);
    synchronized (this) {
      this.writeMemberId = id;
      this.writeDisplayName = displayName == null ? "" : displayName;
    }
    begin(Mode.WRITE);
    openReader(settings.writePrompt());
    return outcome;
  }

  /**
   * Cancels the interaction from any non-terminal phase. No-op once finished.
   */
  public void cancel() {
    if (finish(TagSessionOutcome.cancelled(), CANCELLED_ALERT)) {
      log.debug("Tag session cancelled by caller");
    }
  }

  /**
   * @return current phase
   */
  public synchronized TagSessionPhase phase() {
    return phase;
  }

  /**
   * @return number of multi-tag retries performed so far
   */
  public synchronized int multiTagRetries() {
    return multiTagRetries;
  }

  /**
   * @return the outcome future, also returned by the start methods
   */
  public CompletableFuture<TagSessionOutcome> outcome() {
    return outcome;
  }

  private synchronized void begin(Mode requested) {
    if (phase != TagSessionPhase.IDLE || finished) {
      throw new IllegalStateException("Tag session already started (phase " + phase + ')');
    }
    this.mode = requested;
    this.phase = TagSessionPhase.CONNECTING;
  }

  private void openReader(String prompt) {
    if (!reader.isAvailable()) {
      fail(TagError.NOT_AVAILABLE, "NFC is not available.", null);
      return;
    }
    try {
      reader.begin(prompt);
    } catch (RuntimeException ex) {
      fail(TagError.CONNECTION_FAILED, "Unable to start the reader.", ex);
      return;
    }
    synchronized (this) {
      readerOpen = true;
    }
    poll();
  }

  private void poll() {
    if (!advance(TagSessionPhase.CONNECTING)) {
      return;
    }
    await(reader::detectTags, (tags, error) -> {
      if (error != null) {
        fail(TagError.CONNECTION_FAILED, "Unable to connect to tag.", error);
      } else if (tags == null || tags.isEmpty()) {
        fail(TagError.CONNECTION_FAILED, "Unable to connect to tag.", null);
      } else if (tags.size() > 1) {
        retryAfterMultipleTags(tags.size());
      } else {
        connect(tags.get(0));
      }
    });
  }

  private void retryAfterMultipleTags(int count) {
    int attempt;
    synchronized (this) {
      attempt = ++multiTagRetries;
    }
    metrics.increment("tag.session.multiTagRetry");
    if (settings.retriesBounded() && attempt > settings.maxMultiTagRetries()) {
      log.info("Giving up after {} multi-tag retries", settings.maxMultiTagRetries());
      fail(TagError.CONNECTION_FAILED, MULTI_TAG_ALERT, null);
      return;
    }
    log.debug("{} tags presented; retrying in {} ms (attempt {})",
        count, settings.multiTagRetryInterval().toMillis(), attempt);
    reader.announce(MULTI_TAG_ALERT);
    ScheduledTask task = scheduler.schedule(settings.multiTagRetryInterval(), this::poll);
    synchronized (this) {
      if (finished) {
        task.cancel();
      } else {
        pendingRetry = task;
      }
    }
  }

  private void connect(TagHandle tag) {
    await(() -> reader.connect(tag), (ignored, error) -> {
      if (error != null) {
        fail(TagError.CONNECTION_FAILED, "Unable to connect to tag.", error);
        return;
      }
      queryCapability(tag);
    });
  }

  private void queryCapability(TagHandle tag) {
    if (!advance(TagSessionPhase.QUERYING_CAPABILITY)) {
      return;
    }
    await(() -> reader.queryCapability(tag), (capability, error) -> {
      if (error != null || capability == null) {
        fail(TagError.CAPABILITY_QUERY_FAILED, "Unable to query tag.", error);
        return;
      }
      log.debug("Tag {} capability {}", tag.id(), capability);
      if (capability == TagCapability.NOT_NDEF) {
        fail(TagError.NOT_NDEF_COMPATIBLE, "Tag is not NDEF compatible.", null);
      } else if (currentMode() == Mode.READ) {
        read(tag);
      } else if (capability == TagCapability.READ_ONLY) {
        fail(TagError.READ_ONLY_TAG, "Tag is read-only. Cannot write.", null);
      } else {
        write(tag);
      }
    });
  }

  private void read(TagHandle tag) {
    if (!advance(TagSessionPhase.READING_DATA)) {
      return;
    }
    await(() -> reader.readMessage(tag), (bytes, error) -> {
      if (error != null) {
        fail(TagError.READ_FAILED, "Failed to read tag.", error);
        return;
      }
      if (bytes == null || bytes.length == 0) {
        fail(TagError.EMPTY_TAG, "No data on tag.", null);
        return;
      }
      TagIdentity identity;
      try {
        identity = codec.decode(bytes);
      } catch (TagFormatException ex) {
        fail(ex.error(), "Not a valid Steel tag.", ex);
        return;
      }
      log.info("Read Steel member {} from tag {}", identity.memberId(), tag.id());
      finish(TagSessionOutcome.read(identity), "Steel member detected!");
    });
  }

  private void write(TagHandle tag) {
    if (!advance(TagSessionPhase.WRITING_DATA)) {
      return;
    }
    String memberId;
    String displayName;
    synchronized (this) {
      memberId = writeMemberId;
      displayName = writeDisplayName;
    }
    byte[] payload = codec.encodeBytes(memberId, displayName, clock.now());
    log.debug("Writing {} bytes for member {} (name {})",
        payload.length, memberId, Logs.truncate(displayName, 32));
    await(() -> reader.writeMessage(tag, payload), (ignored, error) -> {
      if (error != null) {
        fail(TagError.WRITE_FAILED, "Write failed.", error);
        return;
      }
      log.info("Wrote Steel identity for member {} to tag {}", memberId, tag.id());
      finish(TagSessionOutcome.written(), "Steel identity written successfully!");
    });
  }

  /**
   * Invokes a reader step and runs the continuation unless the session already finished. A reader
   * cancellation short-circuits to the cancelled outcome.
   */
  private <T> void await(Supplier<CompletableFuture<T>> step, BiConsumer<T, Throwable> continuation) {
    CompletableFuture<T> future;
    try {
      future = Objects.requireNonNull(step.get(), "reader returned null future");
    } catch (RuntimeException ex) {
      future = CompletableFuture.failedFuture(ex);
    }
    future.whenComplete((value, error) -> {
      if (isFinished()) {
        return;
      }
      Throwable cause = unwrap(error);
      if (cause instanceof TagReaderCancelledException) {
        log.debug("Reader session cancelled by user: {}", cause.getMessage());
        finish(TagSessionOutcome.cancelled(), CANCELLED_ALERT);
        return;
      }
      try {
        continuation.accept(value, cause);
      } catch (RuntimeException ex) {
        log.error("Unexpected error in tag session phase {}", phase(), ex);
        fail(failureFor(phase()), "Tag session failed.", ex);
      }
    });
  }

  private synchronized boolean isFinished() {
    return finished;
  }

  private synchronized boolean advance(TagSessionPhase next) {
    if (finished) {
      return false;
    }
    phase = next;
    return true;
  }

  private synchronized Mode currentMode() {
    return mode;
  }

  private void fail(TagError error, String alert, Throwable cause) {
    if (cause != null) {
      log.warn("Tag session failed with {}: {}", error, cause.toString());
    } else {
      log.info("Tag session failed with {}", error);
    }
    if (finish(TagSessionOutcome.failure(error), alert)) {
      metrics.increment("tag.session.error." + error.name().toLowerCase(Locale.ROOT));
    }
  }

  private boolean finish(TagSessionOutcome result, String alert) {
    ScheduledTask retry;
    boolean invalidate;
    synchronized (this) {
      if (finished) {
        return false;
      }
      finished = true;
      phase = TagSessionPhase.FINISHED;
      retry = pendingRetry;
      pendingRetry = null;
      invalidate = readerOpen;
    }
    if (retry != null) {
      retry.cancel();
    }
    if (invalidate) {
      try {
        reader.invalidate(alert);
      } catch (RuntimeException ex) {
        log.warn("Failed to invalidate reader session", ex);
      }
    }
    metrics.increment("tag.session." + result.label());
    outcome.complete(result);
    return true;
  }

  private static TagError failureFor(TagSessionPhase phase) {
    return switch (phase) {
      case QUERYING_CAPABILITY -> TagError.CAPABILITY_QUERY_FAILED;
      case READING_DATA -> TagError.READ_FAILED;
      case WRITING_DATA -> TagError.WRITE_FAILED;
      default -> TagError.CONNECTION_FAILED;
    };
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
