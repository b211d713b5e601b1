/**
 * PIN entry tracking.
 */
package com.exo.steel.domain.pin;
