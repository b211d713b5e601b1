/**
 * Time-related adapters implementing {@link com.exo.steel.application.port.ClockPort}.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package com.exo.steel.infrastructure.time;
