/**
 * Steel tag payload: the three-record identity layout and its error taxonomy.
 *
 * @since 0.1.0
 */
package com.exo.steel.domain.tag;
