package com.exo.steel.application.port;

import java.util.Objects;

/**
 * Opaque reference to one physical tag seen during a reader session.
 *
 * @param id reader-assigned identifier, stable for the lifetime of the reader session
 * @since 0.1.0
 */
public record TagHandle(String id) {
  public TagHandle {
    Objects.requireNonNull(id, "id");
  }
}
