package com.exo.steel.application.tag;

import com.exo.steel.domain.tag.TagError;
import com.exo.steel.domain.tag.TagIdentity;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of a {@link TagSession}.
 *
 * <p>{@link Cancelled} is a distinct outcome and must never be shown to the user as a failure.</p>
 *
 * @since 0.1.0
 */
public sealed interface TagSessionOutcome
    permits TagSessionOutcome.Success, TagSessionOutcome.Failure, TagSessionOutcome.Cancelled {

  /**
   * Read or write completed.
   *
   * @param identity decoded identity for reads; empty for writes
   */
  record Success(Optional<TagIdentity> identity) implements TagSessionOutcome {
    public Success {
      identity = identity == null ? Optional.empty() : identity;
    }
  }

  /**
   * Hardware, session or format failure.
   *
   * @param error failure reason
   */
  record Failure(TagError error) implements TagSessionOutcome {
    public Failure {
      Objects.requireNonNull(error, "error");
    }
  }

  /** Cancelled by the caller or by the user on the reader. */
  record Cancelled() implements TagSessionOutcome {}

  /**
   * @param identity decoded identity
   * @return read success
   */
  static TagSessionOutcome read(TagIdentity identity) {
    return new Success(Optional.of(identity));
  }

  /** @return write success */
  static TagSessionOutcome written() {
    return new Success(Optional.empty());
  }

  /**
   * @param error failure reason
   * @return failure outcome
   */
  static TagSessionOutcome failure(TagError error) {
    return new Failure(error);
  }

  /** @return cancelled outcome */
  static TagSessionOutcome cancelled() {
    return new Cancelled();
  }

  /**
   * @return short lower-case label used for metrics and logs
   */
  default String label() {
    if (this instanceof Success) {
      return "success";
    }
    if (this instanceof Failure) {
      return "failure";
    }
    return "cancelled";
  }
}
