/**
 * <strong>Purpose:</strong> Outbound ports the consent flow depends on: tag hardware, PIN delivery,
 * profile storage, user feedback, time, delays and metrics.
 * <p><strong>Role:</strong> Application layer; adapters under {@code com.exo.steel.infrastructure}
 * implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Asynchronous operations return {@link java.util.concurrent.CompletableFuture};
 * callers re-post completions onto their own executor.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.application.port;
