package com.exo.steel.infrastructure.sms;

import com.exo.steel.application.port.ClockPort;
import com.exo.steel.application.port.CollaboratorException;
import com.exo.steel.application.port.MetricsPort;
import com.exo.steel.application.port.PinDeliveryPort;
import com.exo.steel.domain.verification.VerificationSession;
import com.exo.steel.logging.Logs;
import com.exo.steel.validation.Numbers;
import com.exo.steel.validation.Strings;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-process PIN-delivery service: issues numeric PINs, hands them to a dispatch hook and
 * verifies them against stored sessions.
 * <p><strong>Rules:</strong> unknown sessions, expired sessions and mismatching PINs verify as {@code false};
 * expired sessions are evicted on first use and swept before each new PIN is issued, so the store never
 * outgrows the sessions issued within one timeout window. Comparison is exact string equality.</p>
 * <p><strong>Thread-safety:</strong> Sessions live in a {@link ConcurrentHashMap}; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Emits {@code pin.delivery.sent}, {@code pin.delivery.verified} and
 * {@code pin.delivery.rejected}; PINs are logged masked.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryPinDeliveryAdapter implements PinDeliveryPort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryPinDeliveryAdapter.class);

  /** Default session lifetime. */
  public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofMinutes(2);

  private final ClockPort clock;
  private final Duration sessionTimeout;
  private final int pinLength;
  private final Supplier<String> pinSource;
  private final Consumer<IssuedPin> dispatcher;
  private final MetricsPort metrics;
  private final ConcurrentMap<String, StoredSession> sessions = new ConcurrentHashMap<>();

  /**
   * Creates an adapter.
   *
   * @param clock time source for issue and expiry
   * @param sessionTimeout session lifetime
   * @param pinLength digits per PIN
   * @param pinSource PIN generator; each value must have {@code pinLength} digits
   * @param dispatcher delivery hook standing in for the SMS send
   * @param metrics metrics sink
   */
  public InMemoryPinDeliveryAdapter(
      ClockPort clock,
      Duration sessionTimeout,
      int pinLength,
      Supplier<String> pinSource,
      Consumer<IssuedPin> dispatcher,
      MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sessionTimeout = Objects.requireNonNull(sessionTimeout, "sessionTimeout");
    if (sessionTimeout.isNegative() || sessionTimeout.isZero()) {
      throw new IllegalArgumentException("sessionTimeout must be positive");
    }
    this.pinLength = (int) Numbers.requireRange("pinLength", pinLength, 1, 12);
    this.pinSource = Objects.requireNonNull(pinSource, "pinSource");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Builds a generator of uniformly random PINs of the given length without a leading zero.
   *
   * @param length digits per PIN
   * @return PIN supplier backed by {@link SecureRandom}
   */
  public static Supplier<String> randomPins(int length) {
    Numbers.requireRange("pinLength", length, 1, 12);
    SecureRandom random = new SecureRandom();
    long low = (long) Math.pow(10, length - 1);
    long span = (long) Math.pow(10, length) - low;
    return () -> Long.toString(low + (long) (random.nextDouble() * span));
  }

  /**
   * @param pin PIN returned for every session
   * @return constant PIN supplier for demos
   */
  public static Supplier<String> fixedPin(String pin) {
    String value = Strings.requireNonBlank("pin", pin);
    return () -> value;
  }

  @Override
  public CompletableFuture<VerificationSession> sendPin(String sharerId) {
    if (sharerId == null || sharerId.isBlank()) {
      return CompletableFuture.failedFuture(new CollaboratorException("sendPin", "sharerId is required"));
    }
    purgeExpired();
    try {
      String pin = Strings.requireDigits("pin", pinSource.get(), pinLength);
      Instant now = clock.now();
      Instant expiresAt = now.plus(sessionTimeout);
      String sessionId = UUID.randomUUID().toString();
      sessions.put(sessionId, new StoredSession(sharerId, pin, expiresAt));
      dispatcher.accept(new IssuedPin(sessionId, sharerId, pin, expiresAt));
      metrics.increment("pin.delivery.sent");
      log.info("Issued PIN {} to sharer {} (session {}, expires {})",
          Logs.maskPin(pin), sharerId, sessionId, expiresAt);
      return CompletableFuture.completedFuture(
          new VerificationSession(sessionId, sharerId, now, expiresAt, pinLength, Optional.empty()));
    } catch (RuntimeException ex) {
      log.error("Failed to send verification PIN to sharer {}", sharerId, ex);
      return CompletableFuture.failedFuture(
          new CollaboratorException("sendPin", "failed to send verification PIN", ex));
    }
  }

  @Override
  public CompletableFuture<Boolean> verifyPin(String sessionId, String pin) {
    if (sessionId == null || sessionId.isBlank() || pin == null || pin.isBlank()) {
      return CompletableFuture.failedFuture(
          new CollaboratorException("verifyPin", "sessionId and pin are required"));
    }
    StoredSession stored = sessions.get(sessionId);
    if (stored == null) {
      log.info("PIN rejected: session {} not found or expired", sessionId);
      return rejected();
    }
    if (clock.now().isAfter(stored.expiresAt())) {
      sessions.remove(sessionId);
      log.info("PIN rejected: session {} expired", sessionId);
      return rejected();
    }
    if (stored.pin().equals(pin)) {
      stored.markVerified();
      metrics.increment("pin.delivery.verified");
      log.info("PIN verified for session {}", sessionId);
      return CompletableFuture.completedFuture(Boolean.TRUE);
    }
    log.info("Wrong PIN {} for session {}", Logs.maskPin(pin), sessionId);
    return rejected();
  }

  /**
   * @param sessionId session identifier
   * @param sharerId member the session must belong to
   * @return {@code true} when the session exists, belongs to {@code sharerId}, has not expired and its PIN
   *     was verified
   */
  public boolean isVerifiedFor(String sessionId, String sharerId) {
    if (sessionId == null || sharerId == null) {
      return false;
    }
    StoredSession stored = sessions.get(sessionId);
    return stored != null
        && stored.isVerified()
        && stored.sharerId().equals(sharerId)
        && !clock.now().isAfter(stored.expiresAt());
  }

  /**
   * Evicts every expired session.
   *
   * @return number of evicted sessions
   */
  public int purgeExpired() {
    Instant now = clock.now();
    int before = sessions.size();
    sessions.values().removeIf(stored -> now.isAfter(stored.expiresAt()));
    int evicted = before - sessions.size();
    if (evicted > 0) {
      log.debug("Evicted {} expired verification sessions", evicted);
    }
    return evicted;
  }

  /**
   * @return number of stored sessions
   */
  public int activeSessions() {
    return sessions.size();
  }

  private CompletableFuture<Boolean> rejected() {
    metrics.increment("pin.delivery.rejected");
    return CompletableFuture.completedFuture(Boolean.FALSE);
  }

  private static final class StoredSession {
    private final String sharerId;
    private final String pin;
    private final Instant expiresAt;
    private volatile boolean verified;

    private StoredSession(String sharerId, String pin, Instant expiresAt) {
      this.sharerId = sharerId;
      this.pin = pin;
      this.expiresAt = expiresAt;
    }

    String sharerId() {
      return sharerId;
    }

    String pin() {
      return pin;
    }

    Instant expiresAt() {
      return expiresAt;
    }

    boolean isVerified() {
      return verified;
    }

    void markVerified() {
      verified = true;
    }
  }
}
