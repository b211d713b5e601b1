package com.exo.steel.config;

import com.exo.steel.application.tag.TagSessionSettings;
import com.exo.steel.application.verification.SimulationScript;
import com.exo.steel.application.verification.VerificationSettings;
import com.exo.steel.domain.tag.TagPayloadFormat;
import com.exo.steel.infrastructure.metrics.MetricsSettings;
import com.exo.steel.validation.Numbers;
import com.exo.steel.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable, validated configuration for one Steel runtime.
 * <p><strong>Sources:</strong> built-in defaults overlaid with the flat key map produced by
 * {@link YamlConfigLoader}. Unknown keys are logged and ignored; malformed values raise
 * {@link IllegalArgumentException}.</p>
 *
 * @param mode run mode
 * @param tagFormat tag payload constants
 * @param tagSession tag session retry policy and prompts
 * @param verification PIN length and simulation script
 * @param sessionTimeout lifetime of delivered PIN sessions
 * @param metrics metrics exporter selection
 * @param verboseLogging raise the root log level to DEBUG at startup
 * @since 0.1.0
 */
public record SteelConfig(
    RunMode mode,
    TagPayloadFormat tagFormat,
    TagSessionSettings tagSession,
    VerificationSettings verification,
    Duration sessionTimeout,
    MetricsSettings metrics,
    boolean verboseLogging) {
  private static final Logger log = LoggerFactory.getLogger(SteelConfig.class);

  static final Set<String> KNOWN_KEYS = Set.of(
      "tag.fallbackBaseUrl",
      "tag.externalType",
      "tag.recordVersion",
      "tag.textLanguage",
      "tag.multiTagRetryMillis",
      "tag.maxMultiTagRetries",
      "tag.readPrompt",
      "tag.writePrompt",
      "verification.pinLength",
      "verification.sessionTimeoutSeconds",
      "simulation.sharerId",
      "simulation.pin",
      "simulation.digits",
      "simulation.tagDetectMillis",
      "simulation.pinEntryMillis",
      "simulation.digitIntervalMillis",
      "simulation.settleMillis",
      "simulation.verifyHoldMillis",
      "simulation.revealMillis",
      "metrics.exporter",
      "metrics.endpoint",
      "metrics.exportIntervalSeconds",
      "logging.verbose");

  public SteelConfig {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(tagFormat, "tagFormat");
    Objects.requireNonNull(tagSession, "tagSession");
    Objects.requireNonNull(verification, "verification");
    Objects.requireNonNull(sessionTimeout, "sessionTimeout");
    Objects.requireNonNull(metrics, "metrics");
    if (sessionTimeout.isNegative() || sessionTimeout.isZero()) {
      throw new IllegalArgumentException("verification.sessionTimeoutSeconds must be positive");
    }
  }

  /**
   * @param mode run mode
   * @return built-in defaults
   */
  public static SteelConfig defaults(RunMode mode) {
    return new SteelConfig(
        mode,
        TagPayloadFormat.defaults(),
        TagSessionSettings.defaults(),
        VerificationSettings.defaults(),
        Duration.ofMinutes(2),
        MetricsSettings.defaults(),
        false);
  }

  /**
   * Loads a YAML file over the defaults; a missing file yields the defaults.
   *
   * @param path YAML location
   * @param mode run mode selecting the override section
   * @return merged configuration
   * @throws IOException when the file exists but cannot be read
   */
  public static SteelConfig load(Path path, RunMode mode) throws IOException {
    Map<String, String> values = YamlConfigLoader.load(path, mode).orElseGet(() -> {
      log.info("No configuration at {}; using defaults", path);
      return Map.of();
    });
    return fromMap(mode, values);
  }

  /**
   * Overlays flat key/value pairs onto the defaults.
   *
   * @param mode run mode
   * @param values dotted keys as produced by {@link YamlConfigLoader}
   * @return merged configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static SteelConfig fromMap(RunMode mode, Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Set<String> unknown = new TreeSet<>(values.keySet());
    unknown.removeAll(KNOWN_KEYS);
    if (!unknown.isEmpty()) {
      log.warn("Ignoring unknown configuration keys {}", unknown);
    }
    SteelConfig defaults = defaults(mode);
    Values v = new Values(values);

    TagPayloadFormat format = new TagPayloadFormat(
        v.string("tag.fallbackBaseUrl", defaults.tagFormat().fallbackBaseUrl()),
        v.string("tag.externalType", defaults.tagFormat().externalType()),
        v.string("tag.recordVersion", defaults.tagFormat().recordVersion()),
        v.string("tag.textLanguage", defaults.tagFormat().textLanguage()));

    TagSessionSettings tagDefaults = defaults.tagSession();
    TagSessionSettings tagSession = new TagSessionSettings(
        v.millis("tag.multiTagRetryMillis", tagDefaults.multiTagRetryInterval(), 0, 60_000),
        (int) v.number("tag.maxMultiTagRetries", tagDefaults.maxMultiTagRetries(), 0, 1_000),
        v.string("tag.readPrompt", tagDefaults.readPrompt()),
        v.string("tag.writePrompt", tagDefaults.writePrompt()));

    int pinLength = (int) v.number("verification.pinLength", defaults.verification().pinLength(), 1, 12);
    Duration sessionTimeout = Duration.ofSeconds(
        v.number("verification.sessionTimeoutSeconds", defaults.sessionTimeout().toSeconds(), 1, 86_400));

    SimulationScript script = defaults.verification().simulation();
    SimulationScript simulation = new SimulationScript(
        v.string("simulation.sharerId", script.sharerId()),
        v.string("simulation.pin", script.pin()),
        v.digits("simulation.digits", script.digits()),
        v.millis("simulation.tagDetectMillis", script.tagDetectDelay(), 0, 60_000),
        v.millis("simulation.pinEntryMillis", script.pinEntryDelay(), 0, 60_000),
        v.millis("simulation.digitIntervalMillis", script.digitInterval(), 0, 60_000),
        v.millis("simulation.settleMillis", script.settleDelay(), 0, 60_000),
        v.millis("simulation.verifyHoldMillis", script.verifyHold(), 0, 60_000),
        v.millis("simulation.revealMillis", script.revealDelay(), 0, 60_000),
        sessionTimeout);
    if (mode == RunMode.SIMULATE) {
      // Simulated delivery issues this PIN to every session, live scans included.
      Strings.requireDigits("simulation.pin", simulation.pin(), pinLength);
    }

    MetricsSettings metricDefaults = defaults.metrics();
    MetricsSettings metrics = new MetricsSettings(
        v.string("metrics.exporter", metricDefaults.exporter()),
        v.string("metrics.endpoint", metricDefaults.endpoint()),
        Duration.ofSeconds(v.number(
            "metrics.exportIntervalSeconds", metricDefaults.exportInterval().toSeconds(), 1, 3_600)));

    return new SteelConfig(
        mode,
        format,
        tagSession,
        new VerificationSettings(pinLength, simulation),
        sessionTimeout,
        metrics,
        v.bool("logging.verbose", defaults.verboseLogging()));
  }

  private static final class Values {
    private final Map<String, String> values;

    private Values(Map<String, String> values) {
      this.values = values;
    }

    String string(String key, String fallback) {
      String raw = values.get(key);
      if (raw == null || raw.isBlank()) {
        return fallback;
      }
      return Strings.requireNonBlank(key, raw);
    }

    long number(String key, long fallback, long min, long max) {
      String raw = values.get(key);
      if (raw == null || raw.isBlank()) {
        return fallback;
      }
      long parsed;
      try {
        parsed = Long.parseLong(raw.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(key + " must be numeric (was " + raw + ")", ex);
      }
      return Numbers.requireRange(key, parsed, min, max);
    }

    Duration millis(String key, Duration fallback, long min, long max) {
      return Duration.ofMillis(number(key, fallback.toMillis(), min, max));
    }

    boolean bool(String key, boolean fallback) {
      String raw = values.get(key);
      if (raw == null || raw.isBlank()) {
        return fallback;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "true", "yes", "on" -> true;
        case "false", "no", "off" -> false;
        default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
      };
    }

    List<Integer> digits(String key, List<Integer> fallback) {
      String raw = values.get(key);
      if (raw == null || raw.isBlank()) {
        return fallback;
      }
      List<Integer> parsed = new ArrayList<>();
      for (String token : raw.split(",")) {
        String trimmed = token.trim();
        if (trimmed.length() != 1 || !Character.isDigit(trimmed.charAt(0))) {
          throw new IllegalArgumentException(key + " must list single digits (was " + raw + ")");
        }
        parsed.add(trimmed.charAt(0) - '0');
      }
      return List.copyOf(parsed);
    }
  }
}
