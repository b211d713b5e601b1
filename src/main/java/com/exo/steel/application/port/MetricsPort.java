package com.exo.steel.application.port;

/**
 * <strong>What:</strong> Port abstracting counter and histogram emission.
 * <p><strong>Why:</strong> Lets the tag session and orchestrator record outcomes without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} elsewhere.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept calls from any thread.</p>
 * <p><strong>Observability:</strong> Keys use dotted naming, e.g. {@code flow.transition.pin_entry} or
 * {@code tag.session.multiTagRetry}.</p>
 *
 * @implNote Callers must not pass {@code null} keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records one observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, units defined by the key (e.g. {@code latencyMillis})
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
