package com.exo.steel.application.verification;

import com.exo.steel.application.port.ClockPort;
import com.exo.steel.application.port.DelaySchedulerPort;
import com.exo.steel.application.port.FeedbackEvent;
import com.exo.steel.application.port.FeedbackPort;
import com.exo.steel.application.port.MetricsPort;
import com.exo.steel.application.port.PinDeliveryPort;
import com.exo.steel.application.port.ProfilePort;
import com.exo.steel.application.port.ScheduledTask;
import com.exo.steel.application.tag.TagSession;
import com.exo.steel.application.tag.TagSessionOutcome;
import com.exo.steel.domain.pin.PinState;
import com.exo.steel.domain.profile.MemberProfile;
import com.exo.steel.domain.profile.ProfileRequest;
import com.exo.steel.domain.profile.SampleProfiles;
import com.exo.steel.domain.tag.TagError;
import com.exo.steel.domain.verification.FlowStage;
import com.exo.steel.domain.verification.VerificationError;
import com.exo.steel.domain.verification.VerificationFlowState;
import com.exo.steel.domain.verification.VerificationSession;
import com.exo.steel.logging.Logs;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Top-level state machine for the tap, PIN challenge, reveal sequence.
 * <p><strong>Why:</strong> Enforces that a sharer's private profile layer is released only after a time-boxed PIN
 * challenge succeeds, for both the live path (tag session plus PIN delivery) and the scripted demo.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Sequence {@link FlowStage} transitions strictly in flow order, each at most once per flow.</li>
 *   <li>Own the active {@link VerificationSession} and {@link PinState}; auto-submit a completed PIN once.</li>
 *   <li>Enforce session expiry locally before consulting the PIN-delivery collaborator.</li>
 *   <li>Map every tag, challenge and collaborator failure onto one {@link VerificationError}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Public operations may be called from any thread; they are posted to the flow
 * executor, which must run tasks one at a time. Collaborator completions are re-posted there and discarded
 * when the flow they belong to has been reset. Accessors read published snapshots.</p>
 * <p><strong>Observability:</strong> Emits {@code flow.transition.<stage>}, {@code flow.error.<reason>} and
 * {@code flow.reveal.latencyMillis}; PINs are logged masked only.</p>
 *
 * @since 0.1.0
 */
public final class VerificationOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(VerificationOrchestrator.class);

  private final Supplier<TagSession> tagSessions;
  private final PinDeliveryPort pinDelivery;
  private final ProfilePort profiles;
  private final FeedbackPort feedback;
  private final ClockPort clock;
  private final DelaySchedulerPort scheduler;
  private final Executor flowExecutor;
  private final MetricsPort metrics;
  private final VerificationSettings settings;
  private final List<FlowStateListener> listeners = new CopyOnWriteArrayList<>();

  // Confined to the flow executor.
  private long generation;
  private PinState pin;
  private VerificationSession session;
  private TagSession tagSession;
  private ScheduledTask pendingStep;
  private boolean submitted;
  private boolean scripted;
  private long flowStartedMillis;

  // Published snapshots for accessors.
  private volatile VerificationFlowState state = VerificationFlowState.idle();
  private volatile PinState pinSnapshot;
  private volatile VerificationSession sessionSnapshot;
  private volatile MemberProfile revealedProfile;

  /**
   * Creates an orchestrator.
   *
   * @param tagSessions factory producing a fresh read session per live scan
   * @param pinDelivery PIN-delivery collaborator
   * @param profiles profile-fetch collaborator
   * @param feedback feedback cue sink
   * @param clock time source for expiry checks and scripted sessions
   * @param scheduler delay source for the scripted timeline
   * @param flowExecutor serial executor owning all flow state
   * @param metrics metrics sink
   * @param settings PIN length and simulation script
   */
  public VerificationOrchestrator(
      Supplier<TagSession> tagSessions,
      PinDeliveryPort pinDelivery,
      ProfilePort profiles,
      FeedbackPort feedback,
      ClockPort clock,
      DelaySchedulerPort scheduler,
      Executor flowExecutor,
      MetricsPort metrics,
      VerificationSettings settings) {
    this.tagSessions = Objects.requireNonNull(tagSessions, "tagSessions");
    this.pinDelivery = Objects.requireNonNull(pinDelivery, "pinDelivery");
    this.profiles = Objects.requireNonNull(profiles, "profiles");
    this.feedback = Objects.requireNonNull(feedback, "feedback");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.flowExecutor = Objects.requireNonNull(flowExecutor, "flowExecutor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.pin = new PinState(settings.pinLength());
    this.pinSnapshot = pin.copy();
  }

  /**
   * Resets any prior flow and starts a live tag read.
   */
  public void startLiveScan() {
    flowExecutor.execute(this::beginLiveScan);
  }

  /**
   * Resets any prior flow and runs the scripted demo timeline.
   */
  public void simulate() {
    flowExecutor.execute(this::beginSimulation);
  }

  /**
   * Appends a PIN digit. Ignored unless the flow is in {@link FlowStage#PIN_ENTRY} and driven by a live
   * session; completing the PIN submits it automatically, once.
   *
   * @param digit value in {@code [0,9]}
   * @throws IllegalArgumentException if {@code digit} is not a single decimal digit
   */
  public void enterDigit(int digit) {
    if (digit < 0 || digit > 9) {
      throw new IllegalArgumentException("digit must be between 0 and 9 (was " + digit + ')');
    }
    flowExecutor.execute(() -> acceptDigit(digit));
  }

  /**
   * Removes the last entered digit while in {@link FlowStage#PIN_ENTRY}.
   */
  public void removeLastDigit() {
    flowExecutor.execute(() -> {
      if (state.stage() != FlowStage.PIN_ENTRY || scripted) {
        return;
      }
      if (pin.removeLast()) {
        publishPin();
      }
    });
  }

  /**
   * Returns to {@link FlowStage#IDLE}, cancelling scheduled steps and the tag session and discarding any
   * in-flight collaborator results. Always permitted.
   */
  public void reset() {
    flowExecutor.execute(this::resetNow);
  }

  /**
   * @param listener receiver of {@code (previous, next)} pairs
   */
  public void addListener(FlowStateListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * @param listener previously added listener
   */
  public void removeListener(FlowStateListener listener) {
    listeners.remove(listener);
  }

  /**
   * @return current flow state
   */
  public VerificationFlowState state() {
    return state;
  }

  /**
   * @return copy of the PIN tracker as of the last change
   */
  public PinState pinState() {
    return pinSnapshot.copy();
  }

  /**
   * @return active challenge session, present only during PIN entry, verifying and verified
   */
  public Optional<VerificationSession> currentSession() {
    return Optional.ofNullable(sessionSnapshot);
  }

  /**
   * @return profile released by the last successful flow
   */
  public Optional<MemberProfile> revealedProfile() {
    return Optional.ofNullable(revealedProfile);
  }

  private void beginLiveScan() {
    long token = startFlow(false);
    TagSession read = tagSessions.get();
    tagSession = read;
    transition(token, VerificationFlowState.scanning());
    onFlow(token, read.startRead(), (outcome, error) -> {
      tagSession = null;
      if (error != null) {
        log.warn("Tag session completed exceptionally", error);
        fail(VerificationError.fromTagError(TagError.READ_FAILED));
      } else if (outcome instanceof TagSessionOutcome.Success success && success.identity().isPresent()) {
        String sharerId = success.identity().get().memberId();
        feedback.signal(FeedbackEvent.TAG_DETECTED);
        transition(token, VerificationFlowState.tagDetected(sharerId));
        requestPin(token, sharerId);
      } else if (outcome instanceof TagSessionOutcome.Failure failure) {
        fail(VerificationError.fromTagError(failure.error()));
      } else {
        log.info("Tag scan cancelled; returning to idle");
        resetNow();
      }
    });
  }

  private void requestPin(long token, String sharerId) {
    onFlow(token, call(() -> pinDelivery.sendPin(sharerId)), (issued, error) -> {
      if (error != null || issued == null) {
        log.warn("PIN delivery failed for sharer {}: {}", sharerId, String.valueOf(error));
        fail(VerificationError.NETWORK_ERROR);
        return;
      }
      openPinEntry(token, issued);
    });
  }

  private void openPinEntry(long token, VerificationSession issued) {
    session = issued;
    pin = new PinState(issued.pinLength());
    submitted = false;
    publishPin();
    log.info("PIN challenge {} opened for sharer {} (expires {})",
        issued.sessionId(), issued.sharerId(), issued.expiresAt());
    transition(token, VerificationFlowState.pinEntry(issued.sharerId()));
  }

  private void acceptDigit(int digit) {
    if (state.stage() != FlowStage.PIN_ENTRY || scripted) {
      log.debug("Ignoring digit outside live PIN entry (stage {})", state.stage());
      return;
    }
    if (!appendDigit(digit)) {
      return;
    }
    if (pin.isComplete() && !submitted) {
      submitLivePin(generation);
    }
  }

  private boolean appendDigit(int digit) {
    if (!pin.append(digit)) {
      return false;
    }
    publishPin();
    feedback.signal(FeedbackEvent.PIN_DIGIT_ENTERED);
    return true;
  }

  private void submitLivePin(long token) {
    if (!beginVerification(token)) {
      return;
    }
    VerificationSession active = session;
    String entered = pin.asString();
    log.debug("Verifying PIN {} for session {}", Logs.maskPin(entered), active.sessionId());
    onFlow(token, call(() -> pinDelivery.verifyPin(active.sessionId(), entered)), (verified, error) -> {
      if (error != null || verified == null) {
        log.warn("PIN verification call failed for session {}: {}", active.sessionId(), String.valueOf(error));
        fail(VerificationError.NETWORK_ERROR);
      } else if (!verified) {
        rejectPin(VerificationError.PIN_INCORRECT);
      } else {
        markVerified(token);
        fetchFullProfile(token, active);
      }
    });
  }

  /**
   * Moves to verifying and applies the local expiry check.
   *
   * @return {@code true} when the PIN may be checked
   */
  private boolean beginVerification(long token) {
    if (submitted || session == null) {
      return false;
    }
    submitted = true;
    transition(token, VerificationFlowState.verifying(session.sharerId()));
    Instant now = clock.now();
    if (session.isExpiredAt(now)) {
      log.info("PIN submitted after expiry of session {} ({} > {})", session.sessionId(), now, session.expiresAt());
      rejectPin(VerificationError.PIN_EXPIRED);
      return false;
    }
    return true;
  }

  private void rejectPin(VerificationError reason) {
    pin.clear();
    publishPin();
    feedback.signal(FeedbackEvent.PIN_INCORRECT);
    fail(reason);
  }

  private void markVerified(long token) {
    feedback.signal(FeedbackEvent.PIN_CORRECT);
    transition(token, VerificationFlowState.verified(session.sharerId()));
  }

  private void fetchFullProfile(long token, VerificationSession verified) {
    ProfileRequest request = ProfileRequest.full(verified.sharerId(), verified.sessionId());
    onFlow(token, call(() -> profiles.fetchProfile(request)), (profile, error) -> {
      if (error != null || profile == null) {
        log.warn("Profile fetch failed for member {}: {}", verified.sharerId(), String.valueOf(error));
        fail(VerificationError.NETWORK_ERROR);
        return;
      }
      reveal(token, profile);
    });
  }

  private void reveal(long token, MemberProfile profile) {
    String sharerId = session.sharerId();
    revealedProfile = profile;
    clearSession();
    transition(token, VerificationFlowState.profileRevealed(sharerId));
    feedback.signal(FeedbackEvent.PROFILE_REVEALED);
    metrics.observe("flow.reveal.latencyMillis", Math.max(0L, clock.nowMillis() - flowStartedMillis));
    log.info("Profile of member {} revealed", sharerId);
  }

  private void beginSimulation() {
    long token = startFlow(true);
    transition(token, VerificationFlowState.scanning());
    runStep(token, simulationSteps(token), 0);
  }

  private List<ScheduledStep> simulationSteps(long token) {
    SimulationScript script = settings.simulation();
    List<ScheduledStep> steps = new ArrayList<>();
    steps.add(new ScheduledStep("tagDetected", script.tagDetectDelay(), () -> {
      feedback.signal(FeedbackEvent.TAG_DETECTED);
      transition(token, VerificationFlowState.tagDetected(script.sharerId()));
    }));
    steps.add(new ScheduledStep("pinEntry", script.pinEntryDelay(), () -> {
      Instant now = clock.now();
      VerificationSession scriptedSession = new VerificationSession(
          "simulated-" + token,
          script.sharerId(),
          now,
          now.plus(script.sessionTimeout()),
          script.pin().length(),
          Optional.of(script.pin()));
      openPinEntry(token, scriptedSession);
    }));
    for (Integer digit : script.digits()) {
      steps.add(new ScheduledStep("digit", script.digitInterval(), () -> appendDigit(digit)));
    }
    steps.add(new ScheduledStep("submit", script.settleDelay(), () -> beginVerification(token)));
    steps.add(new ScheduledStep("verify", script.verifyHold(), () -> {
      String expected = session.simulatedPin().orElse("");
      if (expected.equals(pin.asString())) {
        markVerified(token);
      } else {
        rejectPin(VerificationError.PIN_INCORRECT);
      }
    }));
    steps.add(new ScheduledStep("reveal", script.revealDelay(),
        () -> reveal(token, SampleProfiles.demoMember(script.sharerId()))));
    return steps;
  }

  private void runStep(long token, List<ScheduledStep> steps, int index) {
    if (index >= steps.size() || token != generation) {
      return;
    }
    ScheduledStep step = steps.get(index);
    pendingStep = scheduler.schedule(step.delay(), () -> flowExecutor.execute(() -> {
      if (token != generation) {
        log.debug("Discarding scripted step {} of a reset flow", step.name());
        return;
      }
      pendingStep = null;
      step.action().run();
      if (token == generation && !state.stage().isTerminal()) {
        runStep(token, steps, index + 1);
      }
    }));
  }

  private long startFlow(boolean scriptedFlow) {
    resetNow();
    scripted = scriptedFlow;
    flowStartedMillis = clock.nowMillis();
    log.info("Starting {} verification flow", scriptedFlow ? "scripted" : "live");
    return generation;
  }

  private void resetNow() {
    generation++;
    if (pendingStep != null) {
      pendingStep.cancel();
      pendingStep = null;
    }
    TagSession active = tagSession;
    tagSession = null;
    if (active != null) {
      active.cancel();
    }
    clearSession();
    pin = new PinState(settings.pinLength());
    publishPin();
    revealedProfile = null;
    submitted = false;
    scripted = false;
    if (state.stage() != FlowStage.IDLE) {
      transition(generation, VerificationFlowState.idle());
    }
  }

  private void fail(VerificationError reason) {
    Optional<String> sharerId = state.sharerId();
    clearSession();
    metrics.increment("flow.error." + reason.name().toLowerCase(Locale.ROOT));
    log.info("Verification flow failed: {} ({})", reason, reason.message());
    transition(generation, VerificationFlowState.error(reason, sharerId));
  }

  private void clearSession() {
    session = null;
    sessionSnapshot = null;
  }

  private void publishPin() {
    pinSnapshot = pin.copy();
  }

  private void transition(long token, VerificationFlowState next) {
    if (token != generation) {
      log.debug("Dropping transition to {} from a reset flow", next.stage());
      return;
    }
    VerificationFlowState previous = state;
    if (!previous.stage().canAdvanceTo(next.stage())) {
      throw new IllegalStateException("Illegal flow transition " + previous.stage() + " -> " + next.stage());
    }
    state = next;
    // Follows the stage, so a reader never sees a session before PIN_ENTRY is visible.
    sessionSnapshot = next.stage().holdsSession() ? session : null;
    metrics.increment("flow.transition." + next.stage().name().toLowerCase(Locale.ROOT));
    log.debug("Flow transition {} -> {}", previous, next);
    for (FlowStateListener listener : listeners) {
      try {
        listener.onTransition(previous, next);
      } catch (RuntimeException ex) {
        log.warn("Flow state listener {} failed", listener, ex);
      }
    }
  }

  /**
   * Re-posts a collaborator completion onto the flow executor and drops it if the flow was reset meanwhile.
   */
  private <T> void onFlow(long token, CompletableFuture<T> future, BiConsumer<T, Throwable> continuation) {
    future.whenComplete((value, error) -> flowExecutor.execute(() -> {
      if (token != generation) {
        log.debug("Discarding collaborator result of a reset flow");
        return;
      }
      continuation.accept(value, unwrap(error));
    }));
  }

  private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> invocation) {
    try {
      CompletableFuture<T> future = invocation.get();
      return future != null ? future : CompletableFuture.failedFuture(new IllegalStateException("null future"));
    } catch (RuntimeException ex) {
      return CompletableFuture.failedFuture(ex);
    }
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
