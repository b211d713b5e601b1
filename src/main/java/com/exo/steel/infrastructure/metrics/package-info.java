/**
 * <strong>Purpose:</strong> OpenTelemetry-backed implementation of
 * {@link com.exo.steel.application.port.MetricsPort}.
 * <p><strong>Observability:</strong> Exports over OTLP gRPC when enabled; otherwise a noop meter.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.infrastructure.metrics;
