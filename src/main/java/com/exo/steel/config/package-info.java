/**
 * Configuration loading and composition root wiring for the Steel runtime.
 * <p><strong>Role:</strong> Bootstrap layer; turns YAML plus defaults into a {@link com.exo.steel.config.SteelConfig}
 * and a wired adapter graph.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable and safe to share.</p>
 * <p><strong>Security:</strong> Delivered PINs are only ever logged masked.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.config;
