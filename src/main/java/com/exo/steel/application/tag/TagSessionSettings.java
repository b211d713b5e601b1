package com.exo.steel.application.tag;

import com.exo.steel.validation.Numbers;
import com.exo.steel.validation.Strings;
import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for {@link TagSession}.
 *
 * @param multiTagRetryInterval wait before polling again after several tags were presented
 * @param maxMultiTagRetries retry cap for multi-tag presentation; {@code 0} retries until cancelled
 * @param readPrompt prompt shown while waiting for a tag to read
 * @param writePrompt prompt shown while waiting for a tag to write
 * @since 0.1.0
 */
public record TagSessionSettings(
    Duration multiTagRetryInterval, int maxMultiTagRetries, String readPrompt, String writePrompt) {
  /** Retry wait after a multi-tag presentation. */
  public static final Duration DEFAULT_MULTI_TAG_RETRY_INTERVAL = Duration.ofMillis(500);
  /** Prompt shown for read sessions. */
  public static final String DEFAULT_READ_PROMPT = "Hold your iPhone near a Steel card or bracelet.";
  /** Prompt shown for write sessions. */
  public static final String DEFAULT_WRITE_PROMPT =
      "Hold your iPhone near the Steel card to write your identity.";

  public TagSessionSettings {
    Objects.requireNonNull(multiTagRetryInterval, "multiTagRetryInterval");
    if (multiTagRetryInterval.isNegative()) {
      throw new IllegalArgumentException("multiTagRetryInterval must not be negative");
    }
    Numbers.requireRange("maxMultiTagRetries", maxMultiTagRetries, 0, 1_000);
    readPrompt = Strings.requireNonBlank("readPrompt", readPrompt);
    writePrompt = Strings.requireNonBlank("writePrompt", writePrompt);
  }

  /**
   * @return unbounded retries every 500 ms with the default prompts
   */
  public static TagSessionSettings defaults() {
    return new TagSessionSettings(DEFAULT_MULTI_TAG_RETRY_INTERVAL, 0, DEFAULT_READ_PROMPT, DEFAULT_WRITE_PROMPT);
  }

  /**
   * @return {@code true} when multi-tag retries are capped
   */
  public boolean retriesBounded() {
    return maxMultiTagRetries > 0;
  }
}
