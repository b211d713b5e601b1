/**
 * Member profile model with its public and private disclosure layers.
 */
package com.exo.steel.domain.profile;
