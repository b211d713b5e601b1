package com.exo.steel.application.tag;

import com.exo.steel.application.port.MetricsPort;
import com.exo.steel.validation.Strings;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a member's identity payload onto a blank or rewritable tag.
 *
 * <p>Each call runs a fresh write-mode {@link TagSession}; starting a new write cancels one still in
 * progress.</p>
 *
 * @since 0.1.0
 */
public final class TagProvisioningService {
  private static final Logger log = LoggerFactory.getLogger(TagProvisioningService.class);

  private final Supplier<TagSession> sessions;
  private final MetricsPort metrics;
  private TagSession current;

  /**
   * @param sessions factory producing a fresh tag session per write
   * @param metrics metrics sink
   */
  public TagProvisioningService(Supplier<TagSession> sessions, MetricsPort metrics) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Writes the three-record payload for a member.
   *
   * @param memberId identifier to store
   * @param displayName name stored in the text record
   * @return outcome of the write session
   */
  public CompletableFuture<TagSessionOutcome> provision(String memberId, String displayName) {
    String id = Strings.requireNonBlank("memberId", memberId);
    TagSession session;
    synchronized (this) {
      if (current != null) {
        current.cancel();
      }
      session = sessions.get();
      current = session;
    }
    log.info("Provisioning tag for member {}", id);
    return session.startWrite(id, displayName).whenComplete((outcome, error) -> {
      synchronized (this) {
        if (current == session) {
          current = null;
        }
      }
      if (outcome != null) {
        metrics.increment("tag.provision." + outcome.label());
        log.info("Provisioning for member {} finished: {}", id, outcome);
      }
    });
  }

  /**
   * Cancels a write in progress, if any.
   */
  public synchronized void cancel() {
    if (current != null) {
      current.cancel();
      current = null;
    }
  }
}
