/**
 * <strong>Purpose:</strong> Executor and delay-scheduling infrastructure.
 * <p><strong>Concurrency:</strong> The flow executor is single-threaded; scheduled actions hop onto it.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.infrastructure.exec;
