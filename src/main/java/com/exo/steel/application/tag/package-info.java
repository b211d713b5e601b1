/**
 * Tag session state machine and tag provisioning.
 *
 * @since 0.1.0
 */
package com.exo.steel.application.tag;
