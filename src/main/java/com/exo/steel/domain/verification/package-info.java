/**
 * Verification flow stages, state snapshots, challenge sessions and failure reasons.
 * <p><strong>Thread-safety:</strong> Every type here is immutable.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.domain.verification;
