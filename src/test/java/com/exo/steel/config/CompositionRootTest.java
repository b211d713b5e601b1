package com.exo.steel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.exo.steel.application.tag.TagSessionOutcome;
import com.exo.steel.application.verification.VerificationOrchestrator;
import com.exo.steel.domain.tag.TagPayloadCodec;
import com.exo.steel.domain.verification.FlowStage;
import com.exo.steel.infrastructure.tag.ScriptedTagReader;
import com.exo.steel.testutil.RecordingMetrics;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  private static SteelConfig fastSimulation() {
    return SteelConfig.fromMap(RunMode.SIMULATE, Map.of(
        "simulation.tagDetectMillis", "5",
        "simulation.pinEntryMillis", "5",
        "simulation.digitIntervalMillis", "5",
        "simulation.settleMillis", "5",
        "simulation.verifyHoldMillis", "5",
        "simulation.revealMillis", "5"));
  }

  @Test
  void simulationRunsToRevealOnRealExecutors() throws InterruptedException {
    RecordingMetrics metrics = new RecordingMetrics();
    try (CompositionRoot root = new CompositionRoot(fastSimulation(), null, metrics)) {
      VerificationOrchestrator orchestrator = root.orchestrator();
      CountDownLatch revealed = awaitStage(orchestrator, FlowStage.PROFILE_REVEALED);

      orchestrator.simulate();

      assertTrue(revealed.await(5, TimeUnit.SECONDS));
      assertEquals("steel_001", orchestrator.revealedProfile().orElseThrow().id());
      assertEquals("1234", orchestrator.pinState().asString());
    }
    // close() drains the flow executor, so cues signalled after the transition have landed.
    assertEquals(1L, metrics.counter("feedback.profile-revealed"));
  }

  @Test
  void liveScanUsesConfiguredPinInSimulateMode() throws InterruptedException {
    ScriptedTagReader reader = new ScriptedTagReader()
        .withMessage(new TagPayloadCodec().encodeBytes("steel_001", "Alex Rivera", Instant.now()));
    RecordingMetrics metrics = new RecordingMetrics();
    try (CompositionRoot root = new CompositionRoot(fastSimulation(), reader, metrics)) {
      VerificationOrchestrator orchestrator = root.orchestrator();
      CountDownLatch pinEntry = awaitStage(orchestrator, FlowStage.PIN_ENTRY);
      CountDownLatch revealed = awaitStage(orchestrator, FlowStage.PROFILE_REVEALED);

      orchestrator.startLiveScan();
      assertTrue(pinEntry.await(5, TimeUnit.SECONDS));
      for (int digit : new int[] {1, 2, 3, 4}) {
        orchestrator.enterDigit(digit);
      }

      assertTrue(revealed.await(5, TimeUnit.SECONDS));
      assertTrue(orchestrator.revealedProfile().orElseThrow().hasPrivateLayer());
      assertEquals(1L, metrics.counter("pin.delivery.verified"));
      assertEquals(1, root.pinDelivery().activeSessions());
    }
  }

  @Test
  void provisioningWritesThroughSharedReader() {
    ScriptedTagReader reader = new ScriptedTagReader();
    try (CompositionRoot root = new CompositionRoot(SteelConfig.defaults(RunMode.LIVE), reader, new RecordingMetrics())) {
      TagSessionOutcome outcome = root.provisioning().provision("steel_001", "Alex Rivera").join();

      assertTrue(outcome instanceof TagSessionOutcome.Success);
      assertTrue(reader.storedMessage().length > 0);
    }
  }

  @Test
  void missingReaderReportsUnavailable() {
    try (CompositionRoot root = new CompositionRoot(SteelConfig.defaults(RunMode.LIVE), null, new RecordingMetrics())) {
      TagSessionOutcome outcome = root.newTagSession().startRead().join();

      assertFalse(outcome instanceof TagSessionOutcome.Success);
    }
  }

  private static CountDownLatch awaitStage(VerificationOrchestrator orchestrator, FlowStage stage) {
    CountDownLatch latch = new CountDownLatch(1);
    orchestrator.addListener((previous, next) -> {
      if (next.stage() == stage) {
        latch.countDown();
      }
    });
    return latch;
  }
}
