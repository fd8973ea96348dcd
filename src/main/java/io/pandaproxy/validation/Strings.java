package io.pandaproxy.validation;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by the proxy configuration and CLI layers.
 * <p><strong>Why:</strong> Ensures printer addresses and credentials are sanitized before any socket is opened.
 * <p><strong>Role:</strong> Support utilities invoked before adapters allocate network resources.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI, environment or YAML.</li>
 *   <li>Verify printable ASCII constraints for values written into fixed-width wire fields.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
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
   * @return trimmed input with leading/trailing whitespace removed
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
   * Validates that a string is non-blank printable ASCII within a length budget.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum number of characters allowed after trimming
   * @return trimmed, validated value
   * @throws IllegalArgumentException if the value is blank, too long, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Validates that the ASCII encoding of a value fits a fixed-width wire field.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param maxBytes width of the destination field in bytes
   * @return ASCII bytes of the trimmed value
   * @throws IllegalArgumentException if the value is blank, not printable ASCII, or wider than the field
   */
  public static byte[] requireAsciiField(String name, String value, int maxBytes) {
    String sanitized = requirePrintableAscii(name, value, maxBytes);
    return sanitized.getBytes(StandardCharsets.US_ASCII);
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
