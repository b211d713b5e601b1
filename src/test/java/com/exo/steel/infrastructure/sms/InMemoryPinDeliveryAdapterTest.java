package com.exo.steel.infrastructure.sms;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.exo.steel.application.port.CollaboratorException;
import com.exo.steel.domain.verification.VerificationSession;
import com.exo.steel.testutil.MutableClock;
import com.exo.steel.testutil.RecordingMetrics;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryPinDeliveryAdapterTest {
  private static final Instant START = Instant.parse("2025-06-01T09:00:00Z");

  private MutableClock clock;
  private RecordingMetrics metrics;
  private List<IssuedPin> dispatched;
  private InMemoryPinDeliveryAdapter adapter;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    metrics = new RecordingMetrics();
    dispatched = new ArrayList<>();
    adapter = new InMemoryPinDeliveryAdapter(
        clock, Duration.ofMinutes(2), 4, InMemoryPinDeliveryAdapter.fixedPin("0427"), dispatched::add, metrics);
  }

  @Test
  void sendPinIssuesSessionAndDispatchesPin() {
    VerificationSession session = adapter.sendPin("steel_001").join();

    assertEquals("steel_001", session.sharerId());
    assertEquals(START, session.createdAt());
    assertEquals(START.plus(Duration.ofMinutes(2)), session.expiresAt());
    assertEquals(4, session.pinLength());
    assertTrue(session.simulatedPin().isEmpty());
    assertEquals(1, dispatched.size());
    assertEquals("0427", dispatched.get(0).pin());
    assertEquals(session.sessionId(), dispatched.get(0).sessionId());
    assertEquals(1L, metrics.counter("pin.delivery.sent"));
    assertEquals(1, adapter.activeSessions());
  }

  @Test
  void sessionIdsAreUnique() {
    String first = adapter.sendPin("steel_001").join().sessionId();
    String second = adapter.sendPin("steel_001").join().sessionId();

    assertFalse(first.equals(second));
  }

  @Test
  void correctPinVerifiesAndAuthorizesSharer() {
    String sessionId = adapter.sendPin("steel_001").join().sessionId();

    assertFalse(adapter.isVerifiedFor(sessionId, "steel_001"));
    assertTrue(adapter.verifyPin(sessionId, "0427").join());
    assertTrue(adapter.isVerifiedFor(sessionId, "steel_001"));
    assertFalse(adapter.isVerifiedFor(sessionId, "steel_002"));
    assertEquals(1L, metrics.counter("pin.delivery.verified"));
  }

  @Test
  void wrongPinIsRejected() {
    String sessionId = adapter.sendPin("steel_001").join().sessionId();

    assertFalse(adapter.verifyPin(sessionId, "0428").join());
    assertFalse(adapter.isVerifiedFor(sessionId, "steel_001"));
    assertEquals(1L, metrics.counter("pin.delivery.rejected"));
  }

  @Test
  void unknownSessionIsRejected() {
    assertFalse(adapter.verifyPin("nope", "0427").join());
  }

  @Test
  void expiredSessionIsRejectedAndEvicted() {
    String sessionId = adapter.sendPin("steel_001").join().sessionId();
    clock.advance(Duration.ofMinutes(2).plusMillis(1));

    assertFalse(adapter.verifyPin(sessionId, "0427").join());
    assertEquals(0, adapter.activeSessions());
  }

  @Test
  void verificationLapsesWhenSessionExpires() {
    String sessionId = adapter.sendPin("steel_001").join().sessionId();
    adapter.verifyPin(sessionId, "0427").join();

    clock.advance(Duration.ofMinutes(3));

    assertFalse(adapter.isVerifiedFor(sessionId, "steel_001"));
  }

  @Test
  void purgeExpiredEvictsOnlyLapsedSessions() {
    adapter.sendPin("steel_001");
    clock.advance(Duration.ofMinutes(1));
    adapter.sendPin("steel_002");
    clock.advance(Duration.ofSeconds(61));

    assertEquals(1, adapter.purgeExpired());
    assertEquals(1, adapter.activeSessions());
  }

  @Test
  void issuingSweepsLapsedSessionsWithoutExplicitPurge() {
    for (int i = 0; i < 1_000; i++) {
      adapter.sendPin("steel_001").join();
    }
    assertEquals(1_000, adapter.activeSessions());

    clock.advance(Duration.ofHours(1));
    String latest = adapter.sendPin("steel_002").join().sessionId();

    assertEquals(1, adapter.activeSessions());
    assertTrue(adapter.verifyPin(latest, "0427").join());
  }

  @Test
  void blankSharerFailsWithCollaboratorException() {
    CompletableFuture<VerificationSession> future = adapter.sendPin(" ");

    ExecutionException ex = assertThrows(ExecutionException.class, future::get);
    assertInstanceOf(CollaboratorException.class, ex.getCause());
    assertTrue(dispatched.isEmpty());
  }

  @Test
  void malformedGeneratedPinFailsDelivery() {
    InMemoryPinDeliveryAdapter broken = new InMemoryPinDeliveryAdapter(
        clock, Duration.ofMinutes(2), 4, InMemoryPinDeliveryAdapter.fixedPin("12"), dispatched::add, metrics);

    ExecutionException ex = assertThrows(ExecutionException.class, () -> broken.sendPin("steel_001").get());
    assertInstanceOf(CollaboratorException.class, ex.getCause());
    assertEquals(0, broken.activeSessions());
  }

  @Test
  void verifyRequiresSessionAndPin() {
    assertThrows(ExecutionException.class, () -> adapter.verifyPin(null, "0427").get());
    assertThrows(ExecutionException.class, () -> adapter.verifyPin("id", "").get());
  }

  @Test
  void randomPinsHaveRequestedLengthWithoutLeadingZero() {
    Supplier<String> pins = InMemoryPinDeliveryAdapter.randomPins(6);
    for (int i = 0; i < 200; i++) {
      String pin = pins.get();
      assertEquals(6, pin.length());
      assertTrue(pin.chars().allMatch(Character::isDigit));
      assertFalse(pin.startsWith("0"));
    }
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(IllegalArgumentException.class, () -> new InMemoryPinDeliveryAdapter(
        clock, Duration.ZERO, 4, InMemoryPinDeliveryAdapter.fixedPin("1234"), p -> { }, metrics));
  }
}
