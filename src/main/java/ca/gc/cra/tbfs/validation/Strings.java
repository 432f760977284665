package ca.gc.cra.tbfs.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI and YAML configuration.
 * <p><strong>Why:</strong> Command names and cluster paths end up in child process argument vectors; blank
 * or control-character values are rejected before any process is spawned.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
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
   * Returns {@code true} when the value is {@code null} or blank.
   *
   * @param value candidate text
   * @return whether the value carries no content
   */
  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /**
   * Ensures a value is printable ASCII and bounded in length.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum accepted length
   * @return the value unchanged
   * @throws IllegalArgumentException if the value is too long or has characters outside {@code 0x20..0x7E}
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    Objects.requireNonNull(value, name == null ? "value" : name);
    if (value.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "must be at most " + maxLength + " characters"));
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII only"));
      }
    }
    return value;
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
