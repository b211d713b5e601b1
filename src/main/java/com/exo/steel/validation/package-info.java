/**
 * <strong>Purpose:</strong> Input validation helpers for configuration values and identifiers.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.validation;
