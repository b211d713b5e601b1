/**
 * <strong>Purpose:</strong> PIN-delivery adapters.
 * <p><strong>Security:</strong> Clear-text PINs leave the adapter only through the dispatch hook.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.infrastructure.sms;
