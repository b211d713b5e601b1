/**
 * NDEF message model and binary codec (short and long records, URI prefix table, RTD Text).
 * <p><strong>Role:</strong> Pure domain layer with no I/O; decoding failures surface as
 * {@link com.exo.steel.domain.ndef.NdefFormatException}.</p>
 *
 * @since 0.1.0
 */
package com.exo.steel.domain.ndef;
