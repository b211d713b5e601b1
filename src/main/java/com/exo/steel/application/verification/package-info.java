/**
 * <strong>Purpose:</strong> The consent flow: tap, PIN challenge, reveal.
 * <p><strong>Concurrency:</strong> {@link com.exo.steel.application.verification.VerificationOrchestrator}
 * confines its state to one serial flow executor.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.application.verification;
