/**
 * Feedback cue adapters (log-backed and in-memory).
 */
package com.exo.steel.infrastructure.feedback;
