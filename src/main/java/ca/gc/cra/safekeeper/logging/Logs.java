package ca.gc.cra.safekeeper.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Log hygiene helpers.
 * <p><strong>Why:</strong> Keeps operator-supplied text bounded in log lines and shortens addresses in
 * human-facing summaries.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote Truncation decodes with {@link CodingErrorAction#IGNORE} so a cut inside a code point is dropped.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final int ADDRESS_EDGE = 6;

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to a UTF-8 byte budget, noting the original length.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum retained bytes; must be positive
   * @return original value when within budget, otherwise a truncated copy with a suffix
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
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  /**
   * Shortens a long address to its leading and trailing characters, e.g. {@code 0x1234..cdef}.
   *
   * @param address address text; {@code null} yields {@code "<null>"}
   * @return abbreviated form, or the input when already short
   */
  public static String abbreviate(String address) {
    if (address == null) {
      return NULL_PLACEHOLDER;
    }
    if (address.length() <= ADDRESS_EDGE * 2 + 2) {
      return address;
    }
    return address.substring(0, ADDRESS_EDGE) + ".." + address.substring(address.length() - ADDRESS_EDGE + 2);
  }
}
