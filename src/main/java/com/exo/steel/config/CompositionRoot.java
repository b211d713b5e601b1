package com.exo.steel.config;

import com.exo.steel.application.port.ClockPort;
import com.exo.steel.application.port.FeedbackPort;
import com.exo.steel.application.port.MetricsPort;
import com.exo.steel.application.port.TagReaderPort;
import com.exo.steel.application.tag.TagProvisioningService;
import com.exo.steel.application.tag.TagSession;
import com.exo.steel.application.verification.VerificationOrchestrator;
import com.exo.steel.domain.tag.TagPayloadCodec;
import com.exo.steel.infrastructure.exec.ExecutorFactories;
import com.exo.steel.infrastructure.exec.ScheduledExecutorDelayScheduler;
import com.exo.steel.infrastructure.feedback.LoggingFeedbackAdapter;
import com.exo.steel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import com.exo.steel.infrastructure.profile.InMemoryProfileDirectory;
import com.exo.steel.infrastructure.sms.InMemoryPinDeliveryAdapter;
import com.exo.steel.infrastructure.sms.IssuedPin;
import com.exo.steel.infrastructure.tag.UnavailableTagReader;
import com.exo.steel.infrastructure.time.SystemClockAdapter;
import com.exo.steel.logging.LoggingConfigurator;
import com.exo.steel.logging.Logs;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the Steel use cases to concrete adapters.
 * <p><strong>Role:</strong> Translates a {@link SteelConfig} into a ready {@link VerificationOrchestrator} and
 * {@link TagProvisioningService} sharing one clock, metrics sink, flow executor and scheduler.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the PIN source per {@link RunMode}: random PINs live, the configured PIN when simulating.</li>
 *   <li>Fall back to {@link UnavailableTagReader} when no reader is supplied.</li>
 *   <li>Own executor and exporter lifecycles; {@link #close()} releases them.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on one thread during startup; accessors are safe afterwards.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final SteelConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final OpenTelemetryMetricsAdapter ownedMetrics;
  private final ExecutorService flowExecutor;
  private final ScheduledExecutorDelayScheduler scheduler;
  private final InMemoryPinDeliveryAdapter pinDelivery;
  private final InMemoryProfileDirectory profiles;
  private final FeedbackPort feedback;
  private final TagPayloadCodec codec;
  private final TagReaderPort reader;
  private final VerificationOrchestrator orchestrator;
  private final TagProvisioningService provisioning;

  /**
   * Wires the graph with the system clock, the OpenTelemetry adapter and no tag reader.
   *
   * @param config validated configuration
   */
  public CompositionRoot(SteelConfig config) {
    this(config, UnavailableTagReader.INSTANCE, null);
  }

  /**
   * Wires the graph around the supplied reader.
   *
   * @param config validated configuration
   * @param reader tag hardware port; {@code null} selects {@link UnavailableTagReader}
   * @param metricsOverride metrics sink to use instead of the OpenTelemetry adapter; may be {@code null}
   */
  public CompositionRoot(SteelConfig config, TagReaderPort reader, MetricsPort metricsOverride) {
    this.config = Objects.requireNonNull(config, "config");
    if (config.verboseLogging()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    this.clock = new SystemClockAdapter();
    if (metricsOverride == null) {
      this.ownedMetrics = new OpenTelemetryMetricsAdapter(config.metrics());
      this.metrics = ownedMetrics;
    } else {
      this.ownedMetrics = null;
      this.metrics = metricsOverride;
    }
    this.reader = reader == null ? UnavailableTagReader.INSTANCE : reader;
    this.flowExecutor = ExecutorFactories.newFlowExecutor("steel-flow", null);
    this.scheduler = new ScheduledExecutorDelayScheduler(ExecutorFactories.newDelayScheduler("steel-timer", null));
    this.codec = new TagPayloadCodec(config.tagFormat());

    int pinLength = config.verification().pinLength();
    Supplier<String> pinSource = config.mode() == RunMode.SIMULATE
        ? InMemoryPinDeliveryAdapter.fixedPin(config.verification().simulation().pin())
        : InMemoryPinDeliveryAdapter.randomPins(pinLength);
    this.pinDelivery = new InMemoryPinDeliveryAdapter(
        clock, config.sessionTimeout(), pinLength, pinSource, CompositionRoot::dispatch, metrics);
    this.profiles = InMemoryProfileDirectory.withDemoMember(pinDelivery::isVerifiedFor);
    this.feedback = new LoggingFeedbackAdapter(metrics);

    this.orchestrator = new VerificationOrchestrator(
        this::newTagSession,
        pinDelivery,
        profiles,
        feedback,
        clock,
        scheduler,
        flowExecutor,
        metrics,
        config.verification());
    this.provisioning = new TagProvisioningService(this::newTagSession, metrics);
    log.info("Steel runtime wired mode={}, reader={}, metricsExporter={}",
        config.mode(), this.reader.isAvailable() ? "available" : "unavailable", config.metrics().exporter());
  }

  /** @return fresh tag session bound to the shared reader */
  public TagSession newTagSession() {
    return new TagSession(reader, codec, scheduler, clock, metrics, config.tagSession());
  }

  public VerificationOrchestrator orchestrator() {
    return orchestrator;
  }

  public TagProvisioningService provisioning() {
    return provisioning;
  }

  public InMemoryPinDeliveryAdapter pinDelivery() {
    return pinDelivery;
  }

  public InMemoryProfileDirectory profiles() {
    return profiles;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public SteelConfig config() {
    return config;
  }

  /**
   * Stops the executors and flushes the metrics exporter.
   */
  @Override
  public void close() {
    orchestrator.reset();
    provisioning.cancel();
    scheduler.close();
    flowExecutor.shutdown();
    try {
      if (!flowExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
        log.warn("Flow executor did not drain within 2s; forcing shutdown");
        flowExecutor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      flowExecutor.shutdownNow();
    }
    if (ownedMetrics != null) {
      ownedMetrics.close();
    }
  }

  private static void dispatch(IssuedPin issued) {
    log.info("PIN dispatched session={}, sharer={}, pin={}",
        issued.sessionId(), issued.sharerId(), Logs.maskPin(issued.pin()));
  }
}
