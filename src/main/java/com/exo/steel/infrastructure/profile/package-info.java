/**
 * Profile storage adapters.
 */
package com.exo.steel.infrastructure.profile;
