package com.exo.steel.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation for configuration values and member identifiers.
 * <p><strong>Why:</strong> Rejects blank or control-character input before it reaches a tag payload or a
 * collaborator request.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value is a fixed-width string of decimal digits, such as a PIN.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate digits
   * @param length required number of digits
   * @return the validated value
   * @throws IllegalArgumentException if the value is not exactly {@code length} digits
   */
  public static String requireDigits(String name, String value, int length) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() != length || !DIGITS.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name, "must be exactly " + length + " digits"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
