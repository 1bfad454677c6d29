package ca.gc.cra.hostbridge.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Log hygiene helpers for request lines, parameters and results.
 * <p><strong>Why:</strong> Automation clients can send large batch payloads; echoing them whole would flood the
 * console at DEBUG.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use from session threads.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncation mid-codepoint never throws.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  /** Default byte budget for request and response echoes. */
  public static final int DEFAULT_ECHO_BYTES = 256;

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  /**
   * Renders any value with {@link String#valueOf(Object)} and truncates it to {@link #DEFAULT_ECHO_BYTES}.
   *
   * @param value value to summarize
   * @return bounded textual form
   */
  public static String summarize(Object value) {
    return value == null ? NULL_PLACEHOLDER : truncate(String.valueOf(value), DEFAULT_ECHO_BYTES);
  }
}
