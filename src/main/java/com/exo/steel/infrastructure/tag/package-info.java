/**
 * <strong>Purpose:</strong> Tag reader adapters for hosts without platform tag hardware bindings.
 * <p><strong>Concurrency:</strong> Adapters synchronize internally.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.infrastructure.tag;
