/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize PINs and tag text before emission.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 * <p><strong>Security:</strong> PINs are only ever logged through {@link com.exo.steel.logging.Logs#maskPin}.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.logging;
