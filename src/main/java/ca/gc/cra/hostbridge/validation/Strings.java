package ca.gc.cra.hostbridge.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation helpers shared by the bridge configuration, CLI and command registry.
 * <p><strong>Why:</strong> Command names, component type names and host settings arrive from sockets, YAML and the
 * command line; rejecting blank or control-character input early keeps lookups and log lines predictable.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> Emits nothing; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9._$-]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
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
   * Validates an identifier such as a command name or component type name.
   *
   * <p>Identifiers start with a letter or underscore and continue with letters, digits, {@code . _ $ -}. Matching
   * is case-sensitive, so the value is returned trimmed but otherwise untouched.</p>
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate identifier
   * @return validated identifier
   * @throws IllegalArgumentException if the identifier contains unsupported characters
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must start with a letter or underscore and contain only letters, digits, '.', '_', '$' or '-'"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and fits the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string
   * @param maxLength maximum permitted length in characters
   * @return validated value
   * @throws IllegalArgumentException if the value is too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    if (maxLength < 0) {
      throw new IllegalArgumentException("maxLength must not be negative");
    }
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
   * Returns {@code true} when the value is {@code null} or contains only whitespace.
   *
   * @param value candidate text
   * @return whether the value carries no content
   */
  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
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
